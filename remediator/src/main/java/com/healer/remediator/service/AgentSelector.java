package com.healer.remediator.service;

import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.diagnosis.DiagnosisCategory;
import com.healer.remediator.model.AttemptOutcome;
import com.healer.remediator.model.RemediationAttempt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Picks the agent for the next attempt.
 *
 * Routing:
 *   GIT_ISSUE / INFRA_ISSUE  the configured agent for the category
 *   CODE_ISSUE / UNKNOWN     scored from log patterns, workflow name and
 *                            changed files; the configured category agent
 *                            when the scores are inconclusive
 *
 * Once the routed agent has failed twice on this unit, a different agent is
 * chosen from the failing one and the changed files. When that one has also
 * failed twice the fallback agent takes over.
 */
@Component
public class AgentSelector {

    static final int FAILURES_BEFORE_SWITCH = 2;

    /** Agents the scorer can route to. GENERAL is the configured fallback agent. */
    enum Specialty {
        RUST("rex"), FRONTEND("blaze"), INFRA("bolt"), SECURITY("cipher"), GENERAL(null);

        final String agent;

        Specialty(String agent) {
            this.agent = agent;
        }
    }

    private record LogSignal(Specialty specialty, double weight, List<Pattern> patterns) {}

    private static final List<LogSignal> LOG_SIGNALS = List.of(
            new LogSignal(Specialty.RUST, 0.2, patterns(
                    "(?i)clippy", "(?i)cargo\\s+(test|build|check)", "(?i)rustc", "error\\[E\\d+\\]",
                    "warning:\\s*unused", "cannot\\s+find\\s+(crate|type|value)", "Cargo\\.toml")),
            new LogSignal(Specialty.FRONTEND, 0.2, patterns(
                    "(?i)npm\\s+(install|run|test|build)", "(?i)pnpm", "(?i)yarn", "(?i)typescript|tsc",
                    "(?i)eslint", "TS\\d{4}:", "SyntaxError.*\\.tsx?", "Module not found")),
            new LogSignal(Specialty.INFRA, 0.2, patterns(
                    "(?i)docker\\s+(build|push|pull)", "(?i)helm\\s+(template|install|upgrade)",
                    "(?i)kubectl", "(?i)argocd", "(?i)OutOfSync|sync\\s+failed", "Dockerfile",
                    "(?i)yaml\\s*(syntax|error|invalid)", "Chart\\.yaml")),
            new LogSignal(Specialty.SECURITY, 0.3, patterns(
                    "(?i)dependabot", "(?i)vulnerability|CVE-\\d{4}", "(?i)security\\s*advisory",
                    "(?i)code[\\s_-]?scanning", "(?i)secret[\\s_-]?scanning")),
            new LogSignal(Specialty.GENERAL, 0.3, patterns(
                    "(?i)merge\\s+conflict", "(?i)CONFLICT\\s*\\(", "(?i)cannot\\s+merge",
                    "(?i)automatic\\s+merge\\s+failed")));

    private static final Map<Specialty, List<String>> WORKFLOW_KEYWORDS = Map.of(
            Specialty.RUST,     List.of("rust", "clippy", "controller", "healer", "cargo"),
            Specialty.FRONTEND, List.of("frontend", "ui", "web", "npm", "pnpm"),
            Specialty.INFRA,    List.of("docker", "helm", "infra", "deploy", "gitops", "argocd"),
            Specialty.SECURITY, List.of("security", "audit", "scan"));

    static final double CONFIDENCE_THRESHOLD = 0.6;
    static final double WORKFLOW_WEIGHT      = 0.4;
    static final double FILE_WEIGHT          = 0.3;
    static final double GENERAL_BASE         = 0.1;

    private final Map<String, String> agentsByCategory;
    private final String              fallbackAgent;

    @Autowired
    public AgentSelector(HealerProperties props) {
        this(props.getRemediation().getAgents(), props.getRemediation().getFallbackAgent());
    }

    public AgentSelector(Map<String, String> agentsByCategory, String fallbackAgent) {
        // keys may arrive as "git-issue" from YAML or "GIT_ISSUE" from code
        this.agentsByCategory = agentsByCategory.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        e -> e.getKey().trim().toUpperCase(Locale.ROOT).replace('-', '_'),
                        Map.Entry::getValue,
                        (a, b) -> b));
        this.fallbackAgent    = fallbackAgent;
    }

    public String select(RoutingContext ctx, List<RemediationAttempt> previous) {
        String routed = route(ctx);
        if (failures(routed, previous) < FAILURES_BEFORE_SWITCH) {
            return routed;
        }
        String alternative = tryDifferentAgent(routed, ctx);
        if (failures(alternative, previous) < FAILURES_BEFORE_SWITCH) {
            return alternative;
        }
        return fallbackAgent;
    }

    // ------------------------------------------------------------------
    // Routing
    // ------------------------------------------------------------------

    String route(RoutingContext ctx) {
        String configured = agentsByCategory.getOrDefault(ctx.category().name(), fallbackAgent);
        if (ctx.category() == DiagnosisCategory.GIT_ISSUE || ctx.category() == DiagnosisCategory.INFRA_ISSUE) {
            return configured;
        }

        EnumMap<Specialty, Double> scores = new EnumMap<>(Specialty.class);
        for (Specialty s : Specialty.values()) {
            scores.put(s, s == Specialty.GENERAL ? GENERAL_BASE : 0.0);
        }
        int signals = 0;
        if (!ctx.logs().isBlank()) {
            scoreLogs(ctx.logs(), scores);
            signals++;
        }
        if (!ctx.changedFiles().isEmpty()) {
            scoreFiles(ctx.changedFiles(), scores);
            signals++;
        }
        if (!ctx.workflowName().isBlank()) {
            scoreWorkflowName(ctx.workflowName(), scores);
            signals++;
        }

        // fewer independent signals need less agreement
        double threshold = signals <= 1 ? CONFIDENCE_THRESHOLD * 0.3
                         : signals == 2 ? CONFIDENCE_THRESHOLD * 0.5
                         : CONFIDENCE_THRESHOLD;
        Map.Entry<Specialty, Double> best = scores.entrySet().stream()
                .max(Comparator.comparingDouble(Map.Entry::getValue))
                .orElseThrow();
        if (best.getValue() < threshold) {
            return configured;
        }
        return agentFor(best.getKey());
    }

    /**
     * Next agent to try after {@code current} keeps failing. Infrastructure
     * files pull code specialists over to the infrastructure agent; security
     * failures move to whichever code specialist owns the changed files.
     */
    String tryDifferentAgent(String current, RoutingContext ctx) {
        List<String> files = ctx.changedFiles();
        if (current.equals(Specialty.RUST.agent)) {
            return files.stream().anyMatch(f -> f.contains("infra/")) ? Specialty.INFRA.agent : fallbackAgent;
        }
        if (current.equals(Specialty.FRONTEND.agent)) {
            return files.stream().anyMatch(AgentSelector::isInfraFile) ? Specialty.INFRA.agent : fallbackAgent;
        }
        if (current.equals(Specialty.SECURITY.agent)) {
            if (files.stream().anyMatch(AgentSelector::isRustFile))     return Specialty.RUST.agent;
            if (files.stream().anyMatch(AgentSelector::isFrontendFile)) return Specialty.FRONTEND.agent;
        }
        return fallbackAgent;
    }

    private String agentFor(Specialty specialty) {
        return specialty == Specialty.GENERAL ? fallbackAgent : specialty.agent;
    }

    // ------------------------------------------------------------------
    // Scoring
    // ------------------------------------------------------------------

    private static void scoreLogs(String logs, Map<Specialty, Double> scores) {
        for (LogSignal signal : LOG_SIGNALS) {
            long matches = signal.patterns().stream().filter(p -> p.matcher(logs).find()).count();
            if (matches > 0) {
                scores.merge(signal.specialty(), signal.weight() * matches, Double::sum);
            }
        }
    }

    private static void scoreFiles(List<String> files, Map<Specialty, Double> scores) {
        double total = files.size();
        long rust     = files.stream().filter(AgentSelector::isRustFile).count();
        long frontend = files.stream().filter(AgentSelector::isFrontendFile).count();
        long infra    = files.stream().filter(AgentSelector::isInfraFile).count();
        if (rust > 0)     scores.merge(Specialty.RUST,     FILE_WEIGHT * rust / total, Double::sum);
        if (frontend > 0) scores.merge(Specialty.FRONTEND, FILE_WEIGHT * frontend / total, Double::sum);
        if (infra > 0)    scores.merge(Specialty.INFRA,    FILE_WEIGHT * infra / total, Double::sum);
    }

    private static void scoreWorkflowName(String name, Map<Specialty, Double> scores) {
        // match word prefixes, so "ui" does not match "build"
        List<String> words = Arrays.asList(name.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"));
        WORKFLOW_KEYWORDS.forEach((specialty, keywords) -> {
            if (words.stream().anyMatch(w -> keywords.stream().anyMatch(w::startsWith))) {
                scores.merge(specialty, WORKFLOW_WEIGHT, Double::sum);
            }
        });
    }

    static boolean isRustFile(String path) {
        return path.endsWith(".rs") || fileName(path).equals("Cargo.toml") || fileName(path).equals("Cargo.lock");
    }

    static boolean isFrontendFile(String path) {
        String name = fileName(path);
        return List.of(".ts", ".tsx", ".js", ".jsx", ".css", ".scss").stream().anyMatch(path::endsWith)
                || name.equals("package.json") || name.equals("pnpm-lock.yaml");
    }

    static boolean isInfraFile(String path) {
        String name = fileName(path);
        return path.startsWith("infra/") || path.startsWith(".github/")
                || path.endsWith(".yaml") || path.endsWith(".yml")
                || name.equals("Dockerfile") || name.startsWith("Dockerfile.");
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static long failures(String agent, List<RemediationAttempt> previous) {
        return previous.stream()
                .filter(a -> a.getAgent().equals(agent))
                .filter(a -> a.getOutcome() != null && a.getOutcome() != AttemptOutcome.SUCCESS)
                .count();
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }
}
