package com.healer.remediator.diagnosis;

import java.util.List;

/**
 * Root-cause classification handed to the corrective agent.
 */
public record Diagnosis(
        DiagnosisCategory category,
        String            summary,
        String            suggestedFix,
        List<String>      relevantFiles
) {
    public Diagnosis {
        relevantFiles = relevantFiles == null ? List.of() : List.copyOf(relevantFiles);
    }

    public static Diagnosis unknown() {
        return new Diagnosis(DiagnosisCategory.UNKNOWN,
                "Unknown issue - needs investigation",
                "Investigate logs and agent output for root cause",
                List.of());
    }

    public Diagnosis withRelevantFiles(List<String> files) {
        return new Diagnosis(category, summary, suggestedFix, files);
    }
}
