package com.healer.remediator.escalation;

import com.healer.remediator.model.AttemptOutcome;
import com.healer.remediator.model.RemediationAttempt;

import java.time.Duration;

/**
 * One row of the attempt table.
 *
 * @param outcome  null when the attempt never reported one
 * @param duration null when unknown
 */
public record AttemptSummary(
        int            attemptNumber,
        String         agent,
        AttemptOutcome outcome,
        Duration       duration,
        String         failureReason
) {
    public static AttemptSummary from(RemediationAttempt a) {
        return new AttemptSummary(
                a.getAttemptNumber(),
                a.getAgent(),
                a.getOutcome(),
                a.getCompletedAt() != null ? a.duration() : null,
                a.getFailureReason());
    }
}
