package com.healer.remediator.naming;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Names for the corrective jobs this service spawns, and their inverse.
 *
 * Remediation job:  heal-remediation-task{taskId}-{alertType}-{alertId}
 * Fix job:          healer-fix-{subject}-{shortId}   (signals without a task)
 *
 * The alert id is the segment that gets shortened when a name exceeds the
 * length limit. Task ids and alert ids never contain the separator, so every
 * name splits back into its parts one way only.
 */
@Component
public class RemediationJobNames {

    public static final String REMEDIATION_PREFIX = "heal-remediation";
    public static final String FIX_PREFIX         = "healer-fix";

    private static final Pattern ALERT_TYPE   = Pattern.compile("[a-z]\\d+");
    private static final Pattern TASK_SEGMENT = Pattern.compile("task([A-Za-z0-9_.]+)");
    private static final Pattern SEGMENT      = Pattern.compile("[A-Za-z0-9_.]+");
    private static final int     LABEL_MAX    = 63;

    private final NameCodec codec;

    public RemediationJobNames(@Value("${healer.naming.max-length:63}") int maxLength) {
        this.codec = new NameCodec(maxLength);
    }

    /** Parsed parts of a remediation job name. {@code alertId} is empty when it was truncated away. */
    public record Fields(String taskId, String alertType, String alertId) {}

    // ------------------------------------------------------------------
    // Build
    // ------------------------------------------------------------------

    /**
     * True when {@link #remediationJobName} accepts these parts. Signals whose
     * task id or type does not fit get a fix-job name instead.
     */
    public static boolean isNameable(String taskId, String alertType) {
        return taskId != null && SEGMENT.matcher(taskId).matches()
                && alertType != null && ALERT_TYPE.matcher(alertType).matches();
    }

    /**
     * @throws IllegalArgumentException if the task id or alert id contains
     *         anything outside {@code [A-Za-z0-9_.]}, or the alert type is not
     *         a lowercase letter followed by digits
     */
    public Identifier remediationJobName(String taskId, String alertType, String alertId) {
        if (!isNameable(taskId, alertType)) {
            throw new IllegalArgumentException(
                    "Cannot name remediation job for task '" + taskId + "' and type '" + alertType + "'");
        }
        if (alertId != null && !alertId.isEmpty() && !SEGMENT.matcher(alertId).matches()) {
            throw new IllegalArgumentException("Alert id '" + alertId + "' is not a single name segment");
        }
        String fixed = REMEDIATION_PREFIX + NameCodec.SEPARATOR + "task" + taskId
                + NameCodec.SEPARATOR + alertType;
        return codec.buildBounded(fixed, alertId);
    }

    public Identifier fixJobName(String subject, String shortId) {
        return codec.buildBounded(FIX_PREFIX, sanitizeLabelValue(subject).toLowerCase(), shortId);
    }

    // ------------------------------------------------------------------
    // Parse
    // ------------------------------------------------------------------

    /**
     * Extract task id, alert type and alert id from a remediation job name.
     *
     * Returns empty for anything that is not unambiguously one of our names:
     * wrong prefix, a task segment without the {@code task} marker, an alert
     * type that is not a single lowercase letter followed by digits, or more
     * segments than the builder produces.
     */
    public Optional<Fields> parse(String name) {
        if (name == null || !name.startsWith(REMEDIATION_PREFIX + NameCodec.SEPARATOR)) {
            return Optional.empty();
        }
        String rest = name.substring(REMEDIATION_PREFIX.length() + 1);
        String[] parts = rest.split(String.valueOf(NameCodec.SEPARATOR), -1);
        if (parts.length < 2 || parts.length > 3) {
            return Optional.empty();
        }

        var task = TASK_SEGMENT.matcher(parts[0]);
        if (!task.matches() || !ALERT_TYPE.matcher(parts[1]).matches()) {
            return Optional.empty();
        }
        String alertId = parts.length == 3 ? parts[2] : "";
        if (parts.length == 3 && alertId.isEmpty()) {
            return Optional.empty();   // "...-a7-" is never produced by the builder
        }
        return Optional.of(new Fields(task.group(1), parts[1], alertId));
    }

    public Optional<String> alertType(String name) {
        return parse(name).map(Fields::alertType);
    }

    public Optional<String> taskId(String name) {
        return parse(name).map(Fields::taskId);
    }

    // ------------------------------------------------------------------
    // Labels
    // ------------------------------------------------------------------

    /**
     * Make an arbitrary string usable as a Kubernetes-style label value:
     * only {@code [A-Za-z0-9._-]}, at most 63 characters, and no trailing
     * punctuation.
     */
    public static String sanitizeLabelValue(String raw) {
        if (raw == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : raw.toCharArray()) {
            if (sb.length() == LABEL_MAX) break;
            if (Character.isLetterOrDigit(c) && c < 128 || c == '-' || c == '_' || c == '.') {
                sb.append(c);
            }
        }
        int end = sb.length();
        while (end > 0 && "-._".indexOf(sb.charAt(end - 1)) >= 0) {
            end--;
        }
        return sb.substring(0, end);
    }
}
