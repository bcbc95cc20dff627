package com.healer.remediator.success;

public enum SuccessCriterion {
    FEEDBACK_RESOLVED,
    PR_APPROVED,
    STATUS_CHECKS_PASSED,
    NO_CRITICAL_ISSUES,
    MANUAL_SUCCESS_SIGNAL
}
