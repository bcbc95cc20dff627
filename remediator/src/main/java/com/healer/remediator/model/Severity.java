package com.healer.remediator.model;

/** Shared by incoming signals and outgoing escalations. */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String emoji() {
        return switch (this) {
            case LOW      -> "ℹ️";
            case MEDIUM   -> "⚠️";
            case HIGH     -> "🔶";
            case CRITICAL -> "🚨";
        };
    }

    /** Slack attachment colour. */
    public String color() {
        return switch (this) {
            case LOW      -> "#36a64f";
            case MEDIUM   -> "#daa038";
            case HIGH     -> "#ff8c00";
            case CRITICAL -> "#dc3545";
        };
    }

    public static Severity parse(String raw) {
        if (raw == null) return MEDIUM;
        return switch (raw.trim().toLowerCase()) {
            case "low", "info"          -> LOW;
            case "high", "error"        -> HIGH;
            case "critical", "fatal"    -> CRITICAL;
            default                     -> MEDIUM;
        };
    }
}
