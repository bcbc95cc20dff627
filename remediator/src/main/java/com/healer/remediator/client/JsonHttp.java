package com.healer.remediator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small JSON-over-HTTP helper shared by the outbound clients.
 *
 * Every request carries an explicit timeout. Non-2xx responses and I/O
 * failures surface as {@link ExternalCallException}.
 */
public class JsonHttp {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient          http;
    private final ObjectMapper        json;
    private final Map<String, String> defaultHeaders;

    public JsonHttp(ObjectMapper json, Map<String, String> defaultHeaders) {
        this.json           = json;
        this.defaultHeaders = new LinkedHashMap<>(defaultHeaders);
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Verbs
    // ------------------------------------------------------------------

    public String get(String url, String opName) {
        return send(builder(url, DEFAULT_TIMEOUT).GET(), opName);
    }

    public JsonNode getJson(String url, String opName) {
        return readTree(get(url, opName), opName);
    }

    public String post(String url, Object body, String opName) {
        return post(url, body, opName, DEFAULT_TIMEOUT);
    }

    public String post(String url, Object body, String opName, Duration timeout) {
        HttpRequest.Builder b = builder(url, timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)));
        return send(b, opName);
    }

    public String delete(String url, String opName) {
        return send(builder(url, DEFAULT_TIMEOUT).DELETE(), opName);
    }

    public JsonNode readTree(String body, String opName) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalCallException("Failed to parse " + opName + " response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder builder(String url, Duration timeout) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json");
        defaultHeaders.forEach(b::header);
        return b;
    }

    private String send(HttpRequest.Builder builder, String opName) {
        try {
            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExternalCallException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                        resp.statusCode());
            }
            return resp.body();
        } catch (ExternalCallException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExternalCallException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExternalCallException("JSON serialization failed", e);
        }
    }
}
