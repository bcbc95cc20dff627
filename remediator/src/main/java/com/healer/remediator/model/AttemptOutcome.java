package com.healer.remediator.model;

public enum AttemptOutcome {
    SUCCESS,
    AGENT_FAILED,
    CHECKS_FAILING,
    TIMEOUT,
    CANCELLED;

    public String label() {
        return switch (this) {
            case SUCCESS        -> "✅ Success";
            case AGENT_FAILED   -> "❌ Agent failed";
            case CHECKS_FAILING -> "❌ Checks still failing";
            case TIMEOUT        -> "⏱️ Timeout";
            case CANCELLED      -> "🚫 Cancelled";
        };
    }
}
