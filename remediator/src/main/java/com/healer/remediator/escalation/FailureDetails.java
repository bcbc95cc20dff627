package com.healer.remediator.escalation;

import com.healer.remediator.model.Severity;

/**
 * What failed, as shown to the humans receiving an escalation.
 * Every field except signalType and target may be null; those two read
 * "unknown" when missing so a report can still go out.
 */
public record FailureDetails(
        String   signalType,
        String   target,
        Severity severity,
        String   taskId,
        String   repository,
        Integer  prNumber,
        String   workflowName,
        String   diagnosis,
        String   url
) {
    public FailureDetails {
        signalType = signalType == null || signalType.isBlank() ? "unknown" : signalType;
        target     = target == null || target.isBlank() ? "unknown" : target;
    }
}
