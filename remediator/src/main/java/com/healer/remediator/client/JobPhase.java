package com.healer.remediator.client;

/**
 * Phase of a spawned corrective job as reported by the lifecycle API.
 * NOT_FOUND covers jobs deleted out of band, e.g. by a cancellation.
 */
public enum JobPhase {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    NOT_FOUND;

    public static JobPhase parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;   // freshly created jobs report no phase yet
        }
        return switch (raw.trim().toLowerCase()) {
            case "pending"                          -> PENDING;
            case "running", "active"                -> RUNNING;
            case "succeeded", "completed", "complete" -> SUCCEEDED;
            case "failed", "error"                  -> FAILED;
            default                                 -> RUNNING;
        };
    }
}
