package com.healer.remediator.success;

import com.healer.remediator.client.FeedbackItem;
import com.healer.remediator.client.PullRequestClient;
import com.healer.remediator.client.PullRequestState;
import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.model.Severity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.healer.remediator.success.SuccessCriterion.*;

/**
 * Built-in success checks, all backed by {@link PullRequestClient}.
 */
public final class Checks {

    private Checks() {}

    static final String NO_PR = "No pull request associated with this remediation";

    // ------------------------------------------------------------------
    // Feedback resolved
    // ------------------------------------------------------------------

    /** Every reviewer request has been addressed. No feedback at all counts as resolved. */
    @Component
    public static class FeedbackResolved implements SuccessCheck {

        private final PullRequestClient prs;

        public FeedbackResolved(PullRequestClient prs) { this.prs = prs; }

        @Override public SuccessCriterion criterion() { return FEEDBACK_RESOLVED; }

        @Override
        public CriterionResult evaluate(EvaluationState state) {
            if (!state.hasPullRequest()) return CriterionResult.failed(FEEDBACK_RESOLVED, NO_PR);

            List<FeedbackItem> items = prs.listFeedback(state.repository(), state.prNumber().get());
            List<String> unresolved = items.stream()
                    .filter(i -> !i.resolved())
                    .map(i -> i.id() + " (" + i.author() + ")")
                    .toList();
            long resolved = items.size() - unresolved.size();
            Map<String, String> meta = Map.of(
                    "resolved_count", String.valueOf(resolved),
                    "total_count",    String.valueOf(items.size()));
            if (items.isEmpty()) {
                return new CriterionResult(FEEDBACK_RESOLVED, true, "No feedback items to resolve", meta);
            }
            if (unresolved.isEmpty()) {
                return new CriterionResult(FEEDBACK_RESOLVED, true,
                        "All " + items.size() + " feedback items resolved", meta);
            }
            return new CriterionResult(FEEDBACK_RESOLVED, false,
                    resolved + "/" + items.size() + " feedback items resolved. Unresolved: "
                            + String.join(", ", unresolved), meta);
        }
    }

    // ------------------------------------------------------------------
    // PR approved
    // ------------------------------------------------------------------

    @Component
    public static class PullRequestApproved implements SuccessCheck {

        private final PullRequestClient prs;
        private final int               requiredApprovals;

        public PullRequestApproved(PullRequestClient prs,
                                   @Value("${healer.success.required-approvals:1}") int requiredApprovals) {
            this.prs               = prs;
            this.requiredApprovals = requiredApprovals;
        }

        @Override public SuccessCriterion criterion() { return PR_APPROVED; }

        @Override
        public CriterionResult evaluate(EvaluationState state) {
            if (!state.hasPullRequest()) return CriterionResult.failed(PR_APPROVED, NO_PR);

            PullRequestState pr = prs.getPullRequest(state.repository(), state.prNumber().get());
            boolean passed = pr.approvals() >= requiredApprovals || "merged".equals(pr.state());
            String details = passed
                    ? "PR #" + pr.number() + " has " + pr.approvals() + "/" + requiredApprovals + " required approvals"
                    : "PR #" + pr.number() + " missing required approvals (" + pr.approvals() + "/" + requiredApprovals + ")";
            return new CriterionResult(PR_APPROVED, passed, details, Map.of(
                    "required_approvals", String.valueOf(requiredApprovals),
                    "current_approvals",  String.valueOf(pr.approvals())));
        }
    }

    // ------------------------------------------------------------------
    // Status checks
    // ------------------------------------------------------------------

    @Component
    public static class StatusChecksPassed implements SuccessCheck {

        private final PullRequestClient prs;

        public StatusChecksPassed(PullRequestClient prs) { this.prs = prs; }

        @Override public SuccessCriterion criterion() { return STATUS_CHECKS_PASSED; }

        @Override
        public CriterionResult evaluate(EvaluationState state) {
            if (!state.hasPullRequest()) return CriterionResult.failed(STATUS_CHECKS_PASSED, NO_PR);

            PullRequestState pr = prs.getPullRequest(state.repository(), state.prNumber().get());
            Map<String, String> meta = Map.of(
                    "passed_checks", String.valueOf(pr.checksPassed()),
                    "total_checks",  String.valueOf(pr.checksTotal()));
            if (pr.checksTotal() == 0) {
                return new CriterionResult(STATUS_CHECKS_PASSED, false, "No checks reported yet", meta);
            }
            if (pr.allChecksPassed()) {
                return new CriterionResult(STATUS_CHECKS_PASSED, true,
                        "All " + pr.checksTotal() + " checks passed", meta);
            }
            return new CriterionResult(STATUS_CHECKS_PASSED, false,
                    "Failed checks: " + String.join(", ", pr.failedChecks()), meta);
        }
    }

    // ------------------------------------------------------------------
    // No critical issues
    // ------------------------------------------------------------------

    /** No unresolved feedback at HIGH or CRITICAL severity. */
    @Component
    public static class NoCriticalIssues implements SuccessCheck {

        private final PullRequestClient prs;

        public NoCriticalIssues(PullRequestClient prs) { this.prs = prs; }

        @Override public SuccessCriterion criterion() { return NO_CRITICAL_ISSUES; }

        @Override
        public CriterionResult evaluate(EvaluationState state) {
            if (!state.hasPullRequest()) return CriterionResult.failed(NO_CRITICAL_ISSUES, NO_PR);

            List<FeedbackItem> critical = prs.listFeedback(state.repository(), state.prNumber().get())
                    .stream()
                    .filter(i -> !i.resolved())
                    .filter(i -> i.severity() == Severity.HIGH || i.severity() == Severity.CRITICAL)
                    .toList();
            Map<String, String> meta = Map.of("critical_issues_count", String.valueOf(critical.size()));
            if (critical.isEmpty()) {
                return new CriterionResult(NO_CRITICAL_ISSUES, true, "No critical issues remaining", meta);
            }
            return new CriterionResult(NO_CRITICAL_ISSUES, false, "Critical issues found: "
                    + critical.stream().map(FeedbackItem::id).collect(Collectors.joining(", ")), meta);
        }
    }

    // ------------------------------------------------------------------
    // Manual success signal
    // ------------------------------------------------------------------

    @Component
    public static class ManualSuccessSignal implements SuccessCheck {

        private final PullRequestClient prs;
        private final boolean           enabled;

        @Autowired
        public ManualSuccessSignal(PullRequestClient prs, HealerProperties props) {
            this(prs, props.getSuccess().isManualSignalEnabled());
        }

        public ManualSuccessSignal(PullRequestClient prs, boolean enabled) {
            this.prs     = prs;
            this.enabled = enabled;
        }

        @Override public SuccessCriterion criterion() { return MANUAL_SUCCESS_SIGNAL; }

        @Override public boolean enabled() { return enabled; }

        @Override
        public CriterionResult evaluate(EvaluationState state) {
            if (!state.hasPullRequest()) return CriterionResult.failed(MANUAL_SUCCESS_SIGNAL, NO_PR);

            boolean found = prs.hasManualSuccessSignal(state.repository(), state.prNumber().get());
            return new CriterionResult(MANUAL_SUCCESS_SIGNAL, found,
                    found ? "Manual success signal detected" : "No manual success signals found",
                    Map.of("manual_signal_found", String.valueOf(found)));
        }
    }
}
