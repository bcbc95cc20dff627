package com.healer.remediator.diagnosis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.healer.remediator.diagnosis.DiagnosisCategory.*;

/**
 * Rule-based root-cause classifier.
 *
 * Rules are evaluated in list order and the first match wins, so more
 * specific patterns go first. No match yields {@link Diagnosis#unknown()}.
 * A misclassification costs one wasted attempt, so the default rules are
 * conservative and fall through to UNKNOWN readily.
 *
 * diagnose() never throws: a rule that blows up is logged and skipped.
 */
public class DiagnosisEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisEngine.class);

    // path/to/File.ext or path/to/File.ext:123, for the common source extensions
    private static final Pattern SOURCE_FILE = Pattern.compile(
            "(?<![\\w/.-])((?:[\\w.-]+/)*[\\w.-]+\\.(?:rs|java|kt|py|ts|tsx|js|go|yaml|yml|toml))(?::\\d+)?");
    private static final int MAX_RELEVANT_FILES = 10;

    private final List<DiagnosisRule> rules;

    public DiagnosisEngine() {
        this(defaultRules());
    }

    public DiagnosisEngine(List<DiagnosisRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Built-in rules, most specific first.
     *
     * 1. merge conflicts             → GIT_ISSUE
     * 2. auth failures (401/403)     → INFRA_ISSUE
     * 3. timeouts                    → INFRA_ISSUE
     * 4. import / dependency errors  → CODE_ISSUE
     * 5. failing tests               → CODE_ISSUE
     * 6. lint errors                 → CODE_ISSUE
     */
    public static List<DiagnosisRule> defaultRules() {
        return List.of(
                KeywordRule.when("merge-conflict")
                        .logsContainAny("merge conflict", "CONFLICT")
                        .agentOutputContainsAny("conflict")
                        .then(GIT_ISSUE, "Git merge conflict detected",
                                "Add pre-commit rebase step or conflict resolution logic"),
                KeywordRule.when("auth")
                        .logsContainAny("authentication", "401", "403")
                        .then(INFRA_ISSUE, "Authentication/authorization error",
                                "Check credentials and permissions"),
                KeywordRule.when("timeout")
                        .logsContainAny("timeout", "timed out")
                        .then(INFRA_ISSUE, "Operation timed out",
                                "Increase timeout or optimize operation"),
                KeywordRule.when("import")
                        .logsContainAll("import", "error")
                        .then(CODE_ISSUE, "Import/dependency error",
                                "Add missing imports or dependencies"),
                KeywordRule.when("test-failure")
                        .logsContainAll("test", "fail")
                        .then(CODE_ISSUE, "Test failure",
                                "Fix failing tests or update test expectations"),
                KeywordRule.when("lint")
                        .logsContainAny("lint", "clippy")
                        .then(CODE_ISSUE, "Lint/style error",
                                "Fix lint errors in the code"));
    }

    public List<DiagnosisRule> rules() {
        return rules;
    }

    public Diagnosis diagnose(DiagnosisContext context) {
        Diagnosis result = firstMatch(context).orElseGet(Diagnosis::unknown);
        return result.withRelevantFiles(relevantFiles(context.logs()));
    }

    private Optional<Diagnosis> firstMatch(DiagnosisContext context) {
        for (DiagnosisRule rule : rules) {
            try {
                Optional<Diagnosis> d = rule.match(context);
                if (d.isPresent()) {
                    log.debug("Diagnosis rule '{}' matched: {}", rule.name(), d.get().summary());
                    return d;
                }
            } catch (RuntimeException e) {
                log.warn("Diagnosis rule '{}' failed, skipping: {}", rule.name(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    /** Source paths mentioned in the logs, in order of first appearance. */
    static List<String> relevantFiles(String logs) {
        Set<String> files = new LinkedHashSet<>();
        Matcher m = SOURCE_FILE.matcher(logs);
        while (m.find() && files.size() < MAX_RELEVANT_FILES) {
            files.add(m.group(1));
        }
        return List.copyOf(files);
    }
}
