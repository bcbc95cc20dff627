package com.healer.remediator.escalation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healer.remediator.client.JsonHttp;
import com.healer.remediator.config.HealerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Posts an attachment-style message to a Slack incoming webhook.
 */
@Component
public class SlackWebhookChannel implements EscalationChannel {

    private final JsonHttp                 http;
    private final HealerProperties.Webhook config;

    public SlackWebhookChannel(HealerProperties props, ObjectMapper objectMapper) {
        this.config = props.getEscalation().getSlack();
        this.http   = new JsonHttp(objectMapper, Map.of());
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public boolean enabled() {
        return config.isEnabled() && !config.getUrl().isBlank();
    }

    @Override
    public ChannelResult send(EscalationNotification n) {
        http.post(config.getUrl(), payload(n), "slack webhook");
        return ChannelResult.sent(name());
    }

    static Map<String, Object> payload(EscalationNotification n) {
        List<Map<String, Object>> fields = new ArrayList<>();
        n.details().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> fields.add(Map.<String, Object>of("title", e.getKey(), "value", e.getValue(), "short", true)));
        Map<String, Object> attachment = Map.of(
                "color",  n.severity().color(),
                "title",  n.title(),
                "text",   n.message(),
                "fields", fields,
                "ts",     n.timestamp().getEpochSecond());
        return Map.of(
                "text",        n.severity().emoji() + " " + n.title(),
                "attachments", List.of(attachment));
    }
}
