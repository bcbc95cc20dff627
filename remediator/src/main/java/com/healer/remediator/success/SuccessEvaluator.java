package com.healer.remediator.success;

import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.config.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Weighted confidence score over the enabled success checks.
 *
 *   confidence = Σ(weight · passed) / Σ(weight)
 *   success    = confidence ≥ threshold
 *
 * A check that throws counts as failed (its weight stays in the
 * denominator) and its detail names the error. Weights and threshold are
 * validated on construction.
 */
@Component
public class SuccessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SuccessEvaluator.class);

    private final List<SuccessCheck>              checks;
    private final Map<SuccessCriterion, Double>   weights;
    private final double                          threshold;

    @Autowired
    public SuccessEvaluator(List<SuccessCheck> checks, HealerProperties props) {
        this(checks, parseWeights(props.getSuccess().getWeights()), props.getSuccess().getThreshold());
    }

    public SuccessEvaluator(List<SuccessCheck> checks,
                            Map<SuccessCriterion, Double> weights,
                            double threshold) {
        if (threshold < 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new InvalidConfigurationException(
                    "Success threshold must be within [0,1], got " + threshold);
        }
        this.checks    = checks.stream()
                .filter(SuccessCheck::enabled)
                .sorted((a, b) -> a.criterion().compareTo(b.criterion()))
                .toList();
        this.weights   = new EnumMap<>(SuccessCriterion.class);
        this.weights.putAll(weights);
        this.threshold = threshold;

        double sum = 0.0;
        for (SuccessCheck check : this.checks) {
            Double w = weights.get(check.criterion());
            if (w == null) {
                throw new InvalidConfigurationException("No weight configured for " + check.criterion());
            }
            if (w < 0.0 || w.isNaN() || w.isInfinite()) {
                throw new InvalidConfigurationException(
                        "Weight for " + check.criterion() + " must be a non-negative number, got " + w);
            }
            sum += w;
        }
        if (!this.checks.isEmpty() && sum <= 0.0) {
            throw new InvalidConfigurationException("Success weights must not all be zero");
        }
    }

    static Map<SuccessCriterion, Double> parseWeights(Map<String, Double> raw) {
        Map<SuccessCriterion, Double> out = new EnumMap<>(SuccessCriterion.class);
        raw.forEach((key, value) -> {
            String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                out.put(SuccessCriterion.valueOf(normalized), value);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("Unknown success criterion in weights: " + key);
            }
        });
        return out;
    }

    // ------------------------------------------------------------------
    // Evaluate
    // ------------------------------------------------------------------

    public SuccessAssessment evaluate(UUID unitId, EvaluationState state) {
        List<CriterionResult> results = new ArrayList<>();
        for (SuccessCheck check : checks) {
            results.add(runCheck(unitId, check, state));
        }
        double confidence = confidence(results);
        boolean success   = confidence >= threshold;
        String summary = success
                ? String.format(Locale.ROOT, "Success criteria met with %.1f%% confidence", confidence * 100)
                : String.format(Locale.ROOT, "Success criteria not fully met (%.1f%% confidence)", confidence * 100);
        log.info("Remediation {}: {}", unitId, summary);
        return new SuccessAssessment(unitId, results, confidence, success, summary);
    }

    /** Weighted pass ratio, clamped to [0,1]; 0 when there is nothing to weigh. */
    public double confidence(List<CriterionResult> results) {
        double score = 0.0;
        double total = 0.0;
        for (CriterionResult r : results) {
            double w = weights.getOrDefault(r.criterion(), 0.0);
            total += w;
            if (r.passed()) score += w;
        }
        if (total <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score / total));
    }

    private CriterionResult runCheck(UUID unitId, SuccessCheck check, EvaluationState state) {
        try {
            CriterionResult r = check.evaluate(state);
            return r != null ? r : CriterionResult.failed(check.criterion(), "Check returned no result");
        } catch (RuntimeException e) {
            log.warn("Remediation {}: success check {} unavailable: {}",
                    unitId, check.criterion(), e.getMessage());
            return CriterionResult.failed(check.criterion(), "Check unavailable: " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Reporting
    // ------------------------------------------------------------------

    public String breakdown(SuccessAssessment assessment) {
        StringBuilder sb = new StringBuilder();
        sb.append("Success Assessment: ").append(assessment.summary()).append('\n');
        sb.append("Overall Success: ").append(assessment.success()).append('\n');
        sb.append(String.format(Locale.ROOT, "Confidence Score: %.1f%%\n\n", assessment.confidence() * 100));
        sb.append("Criteria Details:\n");
        for (CriterionResult r : assessment.results()) {
            sb.append(r.passed() ? "✅ " : "❌ ").append(r.criterion()).append(": ").append(r.details()).append('\n');
            r.metadata().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append("  - ").append(e.getKey()).append(": ").append(e.getValue()).append('\n'));
            sb.append('\n');
        }
        return sb.toString();
    }

    public double threshold() {
        return threshold;
    }

    public List<SuccessCriterion> activeCriteria() {
        return checks.stream().map(SuccessCheck::criterion).toList();
    }
}
