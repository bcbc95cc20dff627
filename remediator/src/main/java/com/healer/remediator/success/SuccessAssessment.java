package com.healer.remediator.success;

import java.util.List;
import java.util.UUID;

public record SuccessAssessment(
        UUID                  unitId,
        List<CriterionResult> results,
        double                confidence,
        boolean               success,
        String                summary
) {
    public SuccessAssessment {
        results = List.copyOf(results);
    }

    public List<CriterionResult> failedCriteria() {
        return results.stream().filter(r -> !r.passed()).toList();
    }
}
