package com.healer.remediator.client;

import java.util.List;

/**
 * Review, merge and check state of one pull request.
 *
 * @param mergeable  null while GitHub is still computing it
 */
public record PullRequestState(
        int          number,
        String       state,
        Boolean      mergeable,
        String       headSha,
        int          approvals,
        int          checksPassed,
        int          checksTotal,
        List<String> failedChecks
) {
    public PullRequestState {
        failedChecks = failedChecks == null ? List.of() : List.copyOf(failedChecks);
    }

    public boolean allChecksPassed() {
        return checksTotal > 0 && checksPassed == checksTotal;
    }

    /** One-line rendering for prompts and reports. */
    public String summary() {
        return "PR #%d: state=%s, mergeable=%s, checks=%d/%d passed, approvals=%d".formatted(
                number, state, mergeable == null ? "unknown" : mergeable,
                checksPassed, checksTotal, approvals);
    }
}
