package com.healer.remediator.service;

import com.healer.remediator.diagnosis.DiagnosisCategory;

import java.util.List;

/**
 * What agent routing looks at: the diagnosis, the failing workflow's name,
 * the log tail and the files the failure points to.
 */
public record RoutingContext(
        DiagnosisCategory category,
        String            workflowName,
        String            logs,
        List<String>      changedFiles
) {
    public RoutingContext {
        category     = category == null ? DiagnosisCategory.UNKNOWN : category;
        workflowName = workflowName == null ? "" : workflowName;
        logs         = logs == null ? "" : logs;
        changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
    }

    public static RoutingContext of(DiagnosisCategory category) {
        return new RoutingContext(category, "", "", List.of());
    }
}
