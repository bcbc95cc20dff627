package com.healer.remediator.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of the {@code healer.*} block in application.yml.
 *
 * Client base URLs are injected separately with @Value where they are used.
 */
@Component
@ConfigurationProperties(prefix = "healer")
public class HealerProperties {

    private final Dedup       dedup       = new Dedup();
    private final Tracker     tracker     = new Tracker();
    private final Remediation remediation = new Remediation();
    private final Success     success     = new Success();
    private final Escalation  escalation  = new Escalation();

    public Dedup       getDedup()       { return dedup; }
    public Tracker     getTracker()     { return tracker; }
    public Remediation getRemediation() { return remediation; }
    public Success     getSuccess()     { return success; }
    public Escalation  getEscalation()  { return escalation; }

    /**
     * Reject limits that would stop remediation from ever running or ending.
     * Runs once the {@code healer.*} values are bound.
     */
    @PostConstruct
    public void validate() {
        if (remediation.maxAttempts <= 0) {
            throw new InvalidConfigurationException(
                    "healer.remediation.max-attempts must be positive, got " + remediation.maxAttempts);
        }
        requirePositive("healer.remediation.attempt-timeout", remediation.attemptTimeout);
        requirePositive("healer.dedup.window", dedup.window);
        requirePositive("healer.tracker.stage-timeout", tracker.stageTimeout);
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new InvalidConfigurationException(key + " must be a positive duration, got " + value);
        }
    }

    // ------------------------------------------------------------------
    // Dedup
    // ------------------------------------------------------------------

    public static class Dedup {
        /** Trailing window for type-level alert suppression. */
        private Duration window = Duration.ofMinutes(30);

        public Duration getWindow()           { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    // ------------------------------------------------------------------
    // Tracker
    // ------------------------------------------------------------------

    public static class Tracker {
        private Duration stageTimeout = Duration.ofMinutes(30);
        /** Batch the scheduler watches; empty disables the batch sweep. */
        private String   batchId      = "";

        public Duration getStageTimeout()            { return stageTimeout; }
        public void setStageTimeout(Duration v)      { this.stageTimeout = v; }
        public String   getBatchId()                 { return batchId; }
        public void setBatchId(String batchId)       { this.batchId = batchId; }
    }

    // ------------------------------------------------------------------
    // Remediation
    // ------------------------------------------------------------------

    public static class Remediation {
        private int      maxAttempts    = 3;
        private Duration attemptTimeout = Duration.ofMinutes(60);
        private String   fallbackAgent  = "atlas";
        private String   namespace      = "healer";
        /** Diagnosis category name (GIT_ISSUE, ...) to agent. */
        private Map<String, String> agents = new LinkedHashMap<>(Map.of(
                "GIT_ISSUE",   "atlas",
                "INFRA_ISSUE", "bolt",
                "CODE_ISSUE",  "rex",
                "UNKNOWN",     "rex"));

        public int      getMaxAttempts()              { return maxAttempts; }
        public void setMaxAttempts(int v)             { this.maxAttempts = v; }
        public Duration getAttemptTimeout()           { return attemptTimeout; }
        public void setAttemptTimeout(Duration v)     { this.attemptTimeout = v; }
        public String   getFallbackAgent()            { return fallbackAgent; }
        public void setFallbackAgent(String v)        { this.fallbackAgent = v; }
        public String   getNamespace()                { return namespace; }
        public void setNamespace(String v)            { this.namespace = v; }
        public Map<String, String> getAgents()        { return agents; }
        public void setAgents(Map<String, String> v)  { this.agents = v; }
    }

    // ------------------------------------------------------------------
    // Success criteria
    // ------------------------------------------------------------------

    public static class Success {
        private double  threshold            = 0.8;
        private boolean manualSignalEnabled  = true;
        private Map<String, Double> weights  = new LinkedHashMap<>(Map.of(
                "FEEDBACK_RESOLVED",     1.0,
                "PR_APPROVED",           1.0,
                "STATUS_CHECKS_PASSED",  0.8,
                "NO_CRITICAL_ISSUES",    1.0,
                "MANUAL_SUCCESS_SIGNAL", 0.5));

        public double  getThreshold()                   { return threshold; }
        public void setThreshold(double v)              { this.threshold = v; }
        public boolean isManualSignalEnabled()          { return manualSignalEnabled; }
        public void setManualSignalEnabled(boolean v)   { this.manualSignalEnabled = v; }
        public Map<String, Double> getWeights()         { return weights; }
        public void setWeights(Map<String, Double> v)   { this.weights = v; }
    }

    // ------------------------------------------------------------------
    // Escalation
    // ------------------------------------------------------------------

    public static class Escalation {
        private int     workerThreads = 2;
        private Webhook slack         = new Webhook();
        private Webhook discord       = new Webhook();
        private Channel githubIssue   = new Channel();
        private Channel prComment     = new Channel();
        private String  repository    = "";
        private String  mention       = "";

        public int     getWorkerThreads()             { return workerThreads; }
        public void setWorkerThreads(int v)           { this.workerThreads = v; }
        public Webhook getSlack()                     { return slack; }
        public void setSlack(Webhook v)               { this.slack = v; }
        public Webhook getDiscord()                   { return discord; }
        public void setDiscord(Webhook v)             { this.discord = v; }
        public Channel getGithubIssue()               { return githubIssue; }
        public void setGithubIssue(Channel v)         { this.githubIssue = v; }
        public Channel getPrComment()                 { return prComment; }
        public void setPrComment(Channel v)           { this.prComment = v; }
        public String  getRepository()                { return repository; }
        public void setRepository(String v)           { this.repository = v; }
        public String  getMention()                   { return mention; }
        public void setMention(String v)              { this.mention = v; }
    }

    public static class Channel {
        private boolean enabled = false;

        public boolean isEnabled()            { return enabled; }
        public void setEnabled(boolean v)     { this.enabled = v; }
    }

    public static class Webhook extends Channel {
        private String url = "";

        public String getUrl()                { return url; }
        public void setUrl(String url)        { this.url = url; }
    }
}
