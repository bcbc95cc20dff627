package com.healer.remediator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Reads plain-text logs from the log gateway:
 *   GET /logs/jobs/{name}?tail=N
 *   GET /logs/workflows/{name}?tail=N
 */
@Component
public class HttpLogSource implements LogSource {

    private final JsonHttp http;
    private final String   baseUrl;

    public HttpLogSource(@Value("${healer.logs.base-url}") String baseUrl,
                         ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.http    = new JsonHttp(objectMapper, Map.of());
    }

    @Override
    public String jobLogs(String jobRef, int tailLines) {
        return http.get(baseUrl + "/logs/jobs/" + encode(jobRef) + "?tail=" + tailLines,
                "job logs for " + jobRef);
    }

    @Override
    public String workflowLogs(String workflowName, int tailLines) {
        return http.get(baseUrl + "/logs/workflows/" + encode(workflowName) + "?tail=" + tailLines,
                "workflow logs for " + workflowName);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
