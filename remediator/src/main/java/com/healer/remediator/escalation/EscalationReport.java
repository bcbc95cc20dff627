package com.healer.remediator.escalation;

import java.time.Duration;
import java.util.List;

/**
 * Renders the human escalation report as markdown.
 *
 * Section order is fixed: header, failure details, attempt table,
 * last error, call to action.
 */
public final class EscalationReport {

    static final int    MAX_ERROR_CHARS = 2000;
    static final String TRUNCATED       = "...(truncated)";
    static final String CALL_TO_ACTION  =
            "*This issue requires manual intervention. Please investigate and fix the root cause.*";

    private EscalationReport() {}

    public static String title(FailureDetails failure) {
        return "[Healer] Remediation Failed: " + failure.signalType() + " on " + failure.target();
    }

    public static String render(FailureDetails failure, List<AttemptSummary> attempts) {
        StringBuilder md = new StringBuilder();

        md.append("## 🚨 Remediation Escalation\n\n");
        md.append("Automated remediation failed after **").append(attempts.size())
          .append(attempts.size() == 1 ? " attempt" : " attempts").append("**.\n\n");

        // ── Failure details ────────────────────────────────────────────
        md.append("### Failure Details\n\n");
        bullet(md, "Type",       failure.signalType());
        bullet(md, "Target",     failure.target());
        bullet(md, "Severity",   failure.severity() == null ? null : failure.severity().name());
        bullet(md, "Task",       failure.taskId());
        bullet(md, "Repository", failure.repository());
        bullet(md, "Pull Request", failure.prNumber() == null ? null : "#" + failure.prNumber());
        bullet(md, "Workflow",   failure.workflowName());
        bullet(md, "Diagnosis",  failure.diagnosis());
        if (failure.url() != null && !failure.url().isBlank()) {
            md.append("- **[View Run](").append(failure.url()).append(")**\n");
        }
        md.append('\n');

        // ── Attempt table ──────────────────────────────────────────────
        md.append("### Remediation Attempts\n\n");
        md.append("| # | Agent | Outcome | Duration |\n");
        md.append("|---|-------|---------|----------|\n");
        for (AttemptSummary a : attempts) {
            md.append("| ").append(a.attemptNumber())
              .append(" | ").append(a.agent())
              .append(" | ").append(a.outcome() == null ? "Unknown" : a.outcome().label())
              .append(" | ").append(formatDuration(a.duration()))
              .append(" |\n");
        }
        md.append('\n');

        // ── Last error ─────────────────────────────────────────────────
        if (!attempts.isEmpty()) {
            String error = attempts.get(attempts.size() - 1).failureReason();
            if (error != null && !error.isBlank()) {
                md.append("### Last Error\n\n```\n")
                  .append(truncate(error))
                  .append("\n```\n\n");
            }
        }

        md.append("---\n").append(CALL_TO_ACTION).append('\n');
        return md.toString();
    }

    static String truncate(String error) {
        if (error.length() <= MAX_ERROR_CHARS) {
            return error;
        }
        return error.substring(0, MAX_ERROR_CHARS) + TRUNCATED;
    }

    static String formatDuration(Duration d) {
        if (d == null) {
            return "N/A";
        }
        long s = d.getSeconds();
        return s < 60 ? s + "s" : (s / 60) + "m " + (s % 60) + "s";
    }

    private static void bullet(StringBuilder md, String label, String value) {
        if (value != null && !value.isBlank()) {
            md.append("- **").append(label).append("**: ").append(value).append('\n');
        }
    }
}
