package com.healer.remediator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healer.remediator.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GitHub REST v3 implementation of {@link PullRequestClient}.
 *
 * Feedback is derived from reviews: a CHANGES_REQUESTED review is a HIGH
 * severity item, resolved once the same reviewer later approves or the
 * review is dismissed. Manual success is a PR comment starting with one
 * of the configured markers.
 */
@Component
public class GitHubClient implements PullRequestClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    static final List<String> SUCCESS_MARKERS = List.of("/healer success", "✅ Success");

    private final JsonHttp http;
    private final String   baseUrl;

    public GitHubClient(@Value("${healer.github.base-url:https://api.github.com}") String baseUrl,
                        @Value("${healer.github.token:}") String token,
                        ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        if (!token.isBlank()) {
            headers.put("Authorization", "Bearer " + token);
        }
        this.http = new JsonHttp(objectMapper, headers);
    }

    // ------------------------------------------------------------------
    // Read
    // ------------------------------------------------------------------

    @Override
    public PullRequestState getPullRequest(String repository, int number) {
        String op = "PR " + repository + "#" + number;
        JsonNode pr = http.getJson(repoUrl(repository) + "/pulls/" + number, op);

        String state = pr.path("merged").asBoolean(false) ? "merged" : pr.path("state").asText("unknown");
        Boolean mergeable = pr.path("mergeable").isBoolean() ? pr.path("mergeable").asBoolean() : null;
        String headSha = pr.path("head").path("sha").asText("");

        int approvals = 0;
        for (JsonNode review : http.getJson(repoUrl(repository) + "/pulls/" + number + "/reviews", op)) {
            if ("APPROVED".equals(review.path("state").asText())) approvals++;
        }

        int passed = 0;
        int total  = 0;
        List<String> failed = new ArrayList<>();
        if (!headSha.isEmpty()) {
            JsonNode runs = http.getJson(repoUrl(repository) + "/commits/" + headSha + "/check-runs", op)
                    .path("check_runs");
            for (JsonNode run : runs) {
                total++;
                String conclusion = run.path("conclusion").asText("");
                if ("success".equals(conclusion) || "skipped".equals(conclusion) || "neutral".equals(conclusion)) {
                    passed++;
                } else {
                    failed.add(run.path("name").asText("?"));
                }
            }
        }
        return new PullRequestState(number, state, mergeable, headSha, approvals, passed, total, failed);
    }

    @Override
    public List<FeedbackItem> listFeedback(String repository, int number) {
        JsonNode reviews = http.getJson(repoUrl(repository) + "/pulls/" + number + "/reviews",
                "reviews of " + repository + "#" + number);

        // reviews come back oldest first; a later approval resolves earlier change requests
        Map<String, FeedbackItem> open = new LinkedHashMap<>();
        List<FeedbackItem> items = new ArrayList<>();
        for (JsonNode review : reviews) {
            String id     = review.path("id").asText();
            String author = review.path("user").path("login").asText("unknown");
            String state  = review.path("state").asText();
            String body   = review.path("body").asText("");
            switch (state) {
                case "CHANGES_REQUESTED" -> open.put(id,
                        new FeedbackItem(id, author, Severity.HIGH, false, body));
                case "DISMISSED" -> items.add(new FeedbackItem(id, author, Severity.LOW, true, body));
                case "APPROVED" -> open.values().removeIf(item -> {
                    if (item.author().equals(author)) {
                        items.add(new FeedbackItem(item.id(), author, item.severity(), true, item.description()));
                        return true;
                    }
                    return false;
                });
                default -> { }
            }
        }
        items.addAll(open.values());
        return items;
    }

    @Override
    public boolean hasManualSuccessSignal(String repository, int number) {
        JsonNode comments = http.getJson(repoUrl(repository) + "/issues/" + number + "/comments",
                "comments of " + repository + "#" + number);
        for (JsonNode c : comments) {
            String body = c.path("body").asText("").trim();
            String association = c.path("author_association").asText("");
            boolean trusted = association.equals("OWNER") || association.equals("MEMBER")
                    || association.equals("COLLABORATOR");
            if (trusted && SUCCESS_MARKERS.stream().anyMatch(body::startsWith)) {
                return true;
            }
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Write
    // ------------------------------------------------------------------

    @Override
    public void comment(String repository, int number, String body) {
        log.info("Commenting on {}#{}", repository, number);
        http.post(repoUrl(repository) + "/issues/" + number + "/comments",
                Map.of("body", body), "comment on " + repository + "#" + number);
    }

    @Override
    public int createIssue(String repository, String title, String body, List<String> labels) {
        log.info("Creating issue in {}: {}", repository, title);
        String resp = http.post(repoUrl(repository) + "/issues",
                Map.of("title", title, "body", body, "labels", labels),
                "create issue in " + repository);
        return http.readTree(resp, "create issue").path("number").asInt();
    }

    private String repoUrl(String repository) {
        return baseUrl + "/repos/" + repository;
    }
}
