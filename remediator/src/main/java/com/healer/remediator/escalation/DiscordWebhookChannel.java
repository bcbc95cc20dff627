package com.healer.remediator.escalation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healer.remediator.client.JsonHttp;
import com.healer.remediator.config.HealerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts an embed to a Discord webhook. Discord caps embed descriptions at
 * 4096 characters, so long reports are cut.
 */
@Component
public class DiscordWebhookChannel implements EscalationChannel {

    static final int MAX_DESCRIPTION = 4096;

    private final JsonHttp                 http;
    private final HealerProperties.Webhook config;
    private final String                   mention;

    public DiscordWebhookChannel(HealerProperties props, ObjectMapper objectMapper) {
        this.config  = props.getEscalation().getDiscord();
        this.mention = props.getEscalation().getMention();
        this.http    = new JsonHttp(objectMapper, Map.of());
    }

    @Override
    public String name() {
        return "discord";
    }

    @Override
    public boolean enabled() {
        return config.isEnabled() && !config.getUrl().isBlank();
    }

    @Override
    public ChannelResult send(EscalationNotification n) {
        http.post(config.getUrl(), payload(n, mention), "discord webhook");
        return ChannelResult.sent(name());
    }

    static Map<String, Object> payload(EscalationNotification n, String mention) {
        List<Map<String, Object>> fields = new ArrayList<>();
        n.details().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> fields.add(Map.<String, Object>of("name", e.getKey(), "value", e.getValue(), "inline", true)));

        String description = n.message().length() > MAX_DESCRIPTION
                ? n.message().substring(0, MAX_DESCRIPTION - 3) + "..."
                : n.message();

        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title",       n.severity().emoji() + " " + n.title());
        embed.put("description", description);
        embed.put("color",       Integer.parseInt(n.severity().color().substring(1), 16));
        embed.put("fields",      fields);
        embed.put("timestamp",   n.timestamp().toString());

        Map<String, Object> payload = new LinkedHashMap<>();
        if (mention != null && !mention.isBlank()) {
            payload.put("content", mention);
        }
        payload.put("embeds", List.of(embed));
        return payload;
    }
}
