package com.healer.remediator.client;

import java.util.Map;

/**
 * Corrective job request sent to the lifecycle API.
 *
 * @param labels    selector labels; {@code task-id} is always present so the
 *                  job can be found and stopped on cancellation
 * @param params    free-form parameters passed to the agent backend
 */
public record JobSpec(
        String              name,
        String              namespace,
        String              agent,
        String              prompt,
        Map<String, String> labels,
        Map<String, String> params
) {
    public JobSpec {
        labels = Map.copyOf(labels);
        params = Map.copyOf(params);
    }
}
