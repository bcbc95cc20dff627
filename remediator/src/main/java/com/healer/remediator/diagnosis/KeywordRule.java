package com.healer.remediator.diagnosis;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Substring rule over logs and agent output.
 *
 * Built with {@link #when(String)}:
 * <pre>
 *   KeywordRule.when("timeout")
 *       .logsContainAny("timeout", "timed out")
 *       .then(INFRA_ISSUE, "Operation timed out", "Increase timeout or optimize operation");
 * </pre>
 */
public final class KeywordRule implements DiagnosisRule {

    private final String                      name;
    private final Predicate<DiagnosisContext> predicate;
    private final Diagnosis                   result;

    private KeywordRule(String name, Predicate<DiagnosisContext> predicate, Diagnosis result) {
        this.name      = name;
        this.predicate = predicate;
        this.result    = result;
    }

    public static Builder when(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Diagnosis> match(DiagnosisContext context) {
        return predicate.test(context) ? Optional.of(result) : Optional.empty();
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final String name;
        private Predicate<DiagnosisContext> predicate = ctx -> false;

        private Builder(String name) {
            this.name = name;
        }

        /** Logs contain at least one of the keywords (case-sensitive). */
        public Builder logsContainAny(String... keywords) {
            return or(ctx -> containsAny(ctx.logs(), keywords));
        }

        /** Logs contain every one of the keywords. */
        public Builder logsContainAll(String... keywords) {
            return or(ctx -> List.of(keywords).stream().allMatch(ctx.logs()::contains));
        }

        public Builder agentOutputContainsAny(String... keywords) {
            return or(ctx -> containsAny(ctx.agentOutput(), keywords));
        }

        public Builder or(Predicate<DiagnosisContext> other) {
            this.predicate = this.predicate.or(other);
            return this;
        }

        public KeywordRule then(DiagnosisCategory category, String summary, String suggestedFix) {
            return new KeywordRule(name, predicate,
                    new Diagnosis(category, summary, suggestedFix, List.of()));
        }

        private static boolean containsAny(String text, String... keywords) {
            for (String k : keywords) {
                if (text.contains(k)) return true;
            }
            return false;
        }
    }
}
