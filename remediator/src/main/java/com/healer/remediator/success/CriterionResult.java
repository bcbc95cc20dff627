package com.healer.remediator.success;

import java.util.Map;

public record CriterionResult(
        SuccessCriterion    criterion,
        boolean             passed,
        String              details,
        Map<String, String> metadata
) {
    public CriterionResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static CriterionResult passed(SuccessCriterion c, String details) {
        return new CriterionResult(c, true, details, Map.of());
    }

    public static CriterionResult failed(SuccessCriterion c, String details) {
        return new CriterionResult(c, false, details, Map.of());
    }
}
