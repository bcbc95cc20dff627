package com.healer.remediator.model;

import java.time.Instant;
import java.util.Map;

/**
 * A failure report entering the engine: a CI failure, a platform health
 * alert or QA feedback. Not persisted; it lives only until deduplicated
 * or turned into a remediation unit.
 */
public record Signal(
        String              fingerprint,
        String              type,
        String              target,
        Severity            severity,
        Map<String, String> labels,
        Instant             timestamp
) {
    /** Signals carrying this label set to "true" are ignored on ingestion. */
    public static final String EXCLUDE_LABEL = "healer.platform/exclude";

    /** Label naming the task a signal belongs to, when it belongs to one. */
    public static final String TASK_LABEL = "task-id";

    public Signal {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        severity = severity == null ? Severity.MEDIUM : severity;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    /** Create a signal whose fingerprint is derived from its type and target. */
    public static Signal of(String type, String target, Severity severity,
                            Map<String, String> labels) {
        return new Signal(Fingerprints.of(type, target), type, target, severity, labels, Instant.now());
    }

    public boolean excluded() {
        return "true".equalsIgnoreCase(labels.get(EXCLUDE_LABEL));
    }

    public String taskId() {
        return labels.get(TASK_LABEL);
    }
}
