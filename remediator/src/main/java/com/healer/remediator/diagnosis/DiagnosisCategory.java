package com.healer.remediator.diagnosis;

public enum DiagnosisCategory {
    GIT_ISSUE,
    INFRA_ISSUE,
    CODE_ISSUE,
    UNKNOWN
}
