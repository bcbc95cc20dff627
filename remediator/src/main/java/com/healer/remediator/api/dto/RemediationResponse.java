package com.healer.remediator.api.dto;

import com.healer.remediator.model.RemediationUnit;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /remediations/{id}.
 */
public record RemediationResponse(
        UUID    id,
        String  status,
        String  signalType,
        String  target,
        String  taskId,
        String  severity,
        int     attemptCount,
        String  jobRef,
        String  diagnosisCategory,
        String  diagnosisSummary,
        String  lastFailureReason,
        Instant createdAt,
        Instant updatedAt
) {
    public static RemediationResponse from(RemediationUnit u) {
        return new RemediationResponse(
                u.getId(),
                u.getStatus().name(),
                u.getSignalType(),
                u.getTarget(),
                u.getTaskId(),
                u.getSeverity().name(),
                u.getAttemptCount(),
                u.getJobRef(),
                u.getDiagnosisCategory(),
                u.getDiagnosisSummary(),
                u.getLastFailureReason(),
                u.getCreatedAt(),
                u.getUpdatedAt()
        );
    }
}
