package com.healer.remediator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP client for the job lifecycle service.
 *
 *   POST   /jobs                       create
 *   GET    /jobs/{name}                status ({"phase": "..."})
 *   DELETE /jobs/{name}                delete one
 *   DELETE /jobs?labelSelector=k=v,... delete matching ({"deleted": n})
 */
@Component
public class HttpJobClient implements JobClient {

    private static final Logger log = LoggerFactory.getLogger(HttpJobClient.class);

    private final JsonHttp http;
    private final String   baseUrl;

    public HttpJobClient(@Value("${healer.jobs.base-url}") String baseUrl,
                         ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.http    = new JsonHttp(objectMapper, Map.of());
    }

    @Override
    public String submit(JobSpec spec) {
        log.info("Submitting job '{}' (agent={}, labels={})", spec.name(), spec.agent(), spec.labels());
        String body = http.post(baseUrl + "/jobs", spec, "submit job " + spec.name());
        JsonNode node = http.readTree(body, "submit job " + spec.name());
        return node.path("name").asText(spec.name());
    }

    @Override
    public JobPhase getStatus(String jobRef) {
        try {
            JsonNode node = http.getJson(baseUrl + "/jobs/" + encode(jobRef), "status of " + jobRef);
            return JobPhase.parse(node.path("phase").asText(null));
        } catch (ExternalCallException e) {
            if (e.isNotFound()) {
                return JobPhase.NOT_FOUND;
            }
            throw e;
        }
    }

    @Override
    public void delete(String jobRef) {
        log.info("Deleting job '{}'", jobRef);
        try {
            http.delete(baseUrl + "/jobs/" + encode(jobRef), "delete job " + jobRef);
        } catch (ExternalCallException e) {
            if (!e.isNotFound()) {
                throw e;
            }
        }
    }

    @Override
    public int deleteMatching(Map<String, String> labelSelector) {
        String selector = labelSelector.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
        log.info("Deleting jobs matching {}", selector);
        String body = http.delete(baseUrl + "/jobs?labelSelector=" + encode(selector),
                "delete jobs " + selector);
        if (body == null || body.isBlank()) {
            return 0;
        }
        return http.readTree(body, "delete jobs " + selector).path("deleted").asInt(0);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
