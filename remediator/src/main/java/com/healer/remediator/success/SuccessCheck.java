package com.healer.remediator.success;

/**
 * One independent success criterion.
 *
 * evaluate() may throw when its data source is unreachable; the evaluator
 * turns that into a failed result.
 */
public interface SuccessCheck {

    SuccessCriterion criterion();

    CriterionResult evaluate(EvaluationState state);

    /** Disabled checks are left out of the score entirely. */
    default boolean enabled() {
        return true;
    }
}
