package com.healer.remediator.api.dto;

import com.healer.remediator.model.Severity;
import com.healer.remediator.model.Signal;

import java.util.Map;

/**
 * Request body for POST /signals.
 *
 * Required: type, target
 * Optional: severity (defaults to MEDIUM), labels. A "task-id" label links
 *   the signal to a batch task; "healer.platform/exclude": "true" drops it.
 */
public record SignalRequest(String type, String target, String severity, Map<String, String> labels) {

    public Signal toSignal() {
        return Signal.of(type, target, Severity.parse(severity), labels);
    }
}
