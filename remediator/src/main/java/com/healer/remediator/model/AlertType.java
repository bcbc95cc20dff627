package com.healer.remediator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known alert codes. Signals may carry other types; these are the ones the
 * service raises itself or knows a display name for.
 */
public enum AlertType {
    A1("a1", "Comment Order"),
    A2("a2", "Silent Failure"),
    A3("a3", "Stale Progress"),
    A4("a4", "Approval Loop"),
    A5("a5", "Post-Test CI Failure"),
    A7("a7", "Pod Failure"),
    A8("a8", "Step Timeout"),
    A9("a9", "Stuck Job");

    private final String code;
    private final String displayName;

    AlertType(String code, String displayName) {
        this.code        = code;
        this.displayName = displayName;
    }

    public String code()        { return code; }
    public String displayName() { return displayName; }

    public static Optional<AlertType> fromCode(String code) {
        return Arrays.stream(values()).filter(t -> t.code.equalsIgnoreCase(code)).findFirst();
    }

    /** "[HEAL-A7] Pod Failure: pod-123", or "[HEAL] ci-failure: repo" for unknown types. */
    public static String alertTitle(String type, String target) {
        return fromCode(type)
                .map(t -> "[HEAL-" + t.code.toUpperCase() + "] " + t.displayName + ": " + target)
                .orElse("[HEAL] " + type + ": " + target);
    }
}
