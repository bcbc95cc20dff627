package com.healer.remediator.success;

import java.util.Optional;

/**
 * What the checks need to know about the attempt under evaluation.
 *
 * @param prNumber empty when the remediated work has no pull request
 */
public record EvaluationState(String repository, Optional<Integer> prNumber) {

    public EvaluationState {
        prNumber = prNumber == null ? Optional.empty() : prNumber;
    }

    public static EvaluationState forPullRequest(String repository, int prNumber) {
        return new EvaluationState(repository, Optional.of(prNumber));
    }

    public boolean hasPullRequest() {
        return repository != null && !repository.isBlank() && prNumber.isPresent();
    }
}
