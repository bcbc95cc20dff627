package com.healer.remediator.client;

/**
 * Thrown when an external API (job lifecycle, logs, GitHub, webhooks)
 * returns an error or cannot be reached. Callers degrade instead of failing
 * the poll cycle.
 */
public class ExternalCallException extends RuntimeException {

    private final int status;

    public ExternalCallException(String message) {
        this(message, -1);
    }

    public ExternalCallException(String message, int status) {
        super(message);
        this.status = status;
    }

    public ExternalCallException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /** HTTP status, or -1 when the call never got a response. */
    public int status() {
        return status;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
