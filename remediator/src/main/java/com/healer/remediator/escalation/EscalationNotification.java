package com.healer.remediator.escalation;

import com.healer.remediator.model.Severity;

import java.time.Instant;
import java.util.Map;

/**
 * Channel-agnostic escalation event. {@code message} is the full markdown
 * report; {@code details} carries the structured fields channels may want
 * (repository, pr-number, target, ...).
 */
public record EscalationNotification(
        String              id,
        Severity            severity,
        String              title,
        String              message,
        Map<String, String> details,
        Instant             timestamp
) {
    public static final String REPOSITORY = "repository";
    public static final String PR_NUMBER  = "pr-number";
    public static final String TARGET     = "target";
    public static final String TYPE       = "type";
    public static final String ATTEMPTS   = "attempts";
    public static final String AGENTS     = "agents";
    public static final String URL        = "url";

    public EscalationNotification {
        details = Map.copyOf(details);
    }

    public String detail(String key) {
        return details.get(key);
    }
}
