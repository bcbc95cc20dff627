package com.healer.remediator.model;

/**
 * Lifecycle of a remediation unit.
 *
 *   PENDING → IN_PROGRESS → SUCCEEDED
 *                         → FAILED → IN_PROGRESS (next attempt, attempt count +1)
 *                                  → ESCALATED
 *   any non-terminal      → CANCELLED
 */
public enum RemediationStatus {
    PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    ESCALATED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == ESCALATED || this == CANCELLED;
    }

    /**
     * FAILED → IN_PROGRESS is only legal together with an attempt increment;
     * RemediationUnit.startAttempt() is the single place that does both.
     */
    public boolean canTransitionTo(RemediationStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return switch (this) {
            case PENDING     -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == SUCCEEDED || next == FAILED;
            case FAILED      -> next == IN_PROGRESS || next == ESCALATED;
            default          -> false;
        };
    }
}
