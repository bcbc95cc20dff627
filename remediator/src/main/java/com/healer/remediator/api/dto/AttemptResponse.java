package com.healer.remediator.api.dto;

import com.healer.remediator.model.AttemptOutcome;
import com.healer.remediator.model.RemediationAttempt;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of GET /remediations/{id}/attempts. outcome is null while the job runs.
 */
public record AttemptResponse(
        UUID           id,
        int            attemptNumber,
        String         agent,
        String         jobRef,
        AttemptOutcome outcome,
        String         failureReason,
        Instant        startedAt,
        Instant        completedAt
) {
    public static AttemptResponse from(RemediationAttempt a) {
        return new AttemptResponse(
                a.getId(),
                a.getAttemptNumber(),
                a.getAgent(),
                a.getJobRef(),
                a.getOutcome(),
                a.getFailureReason(),
                a.getStartedAt(),
                a.getCompletedAt()
        );
    }
}
