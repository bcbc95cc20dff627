package com.healer.remediator.tracker;

import java.util.Optional;

/**
 * Stages a task passes through, in order.
 */
public enum Stage {
    PENDING("Pending", null),
    IMPLEMENTATION("Implementation", "rex"),
    QUALITY("Quality", "cleo"),
    SECURITY("Security", "cipher"),
    TESTING("Testing", "tess"),
    INTEGRATION("Atlas Integration", "atlas"),
    WAITING_MERGE("Waiting Merge", null),
    COMPLETED("Completed", null),
    FAILED("Failed", null);

    private final String displayName;
    private final String agent;

    Stage(String displayName, String agent) {
        this.displayName = displayName;
        this.agent       = agent;
    }

    public String displayName() { return displayName; }

    /** Agent that owns this stage, if any. */
    public Optional<String> agent() { return Optional.ofNullable(agent); }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Parse the value stored in a task record. Writers have used both the
     * long and the short names over time, so both are accepted.
     */
    public static Optional<Stage> fromRecordValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(switch (value.trim().toLowerCase()) {
            case "pending"                                       -> PENDING;
            case "implementation-in-progress", "implementation"  -> IMPLEMENTATION;
            case "quality-in-progress", "quality"                -> QUALITY;
            case "security-in-progress", "security"              -> SECURITY;
            case "testing-in-progress", "testing"                -> TESTING;
            case "waiting-atlas-integration", "atlas"            -> INTEGRATION;
            case "waiting-pr-merged", "merge"                    -> WAITING_MERGE;
            case "completed", "complete", "done"                 -> COMPLETED;
            case "failed", "error"                               -> FAILED;
            default                                              -> null;
        });
    }

    @Override
    public String toString() {
        return displayName;
    }
}
