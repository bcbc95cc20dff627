package com.healer.remediator.config;

/**
 * Thrown at startup when a setting cannot be used as given
 * (non-positive limits or timeouts, negative weights, thresholds outside [0,1]).
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
