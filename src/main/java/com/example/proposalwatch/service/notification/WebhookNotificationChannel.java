package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.NotificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts the digest to a Discord or generic JSON webhook.
 */
@Slf4j
@Component
public class WebhookNotificationChannel implements NotificationChannel {

    static final int DISCORD_BLUE = 3447003;

    private final WebhookClient webhookClient;
    private final NotificationProperties.Webhook properties;

    public WebhookNotificationChannel(WebhookClient webhookClient, NotificationProperties properties) {
        this.webhookClient = webhookClient;
        this.properties = properties.getWebhook();
    }

    @Override
    public String getName() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled() && properties.getUrl() != null && !properties.getUrl().isBlank();
    }

    @Override
    public void send(ProposalDigest digest) {
        webhookClient.post(properties.getUrl(), buildPayload(digest));
    }

    Map<String, Object> buildPayload(ProposalDigest digest) {
        if ("discord".equalsIgnoreCase(properties.getType())) {
            var fields = new ArrayList<Map<String, Object>>();
            for (var field : digest.getFields()) {
                fields.add(Map.of("name", field.getName(), "value", field.getValue(), "inline", true));
            }

            var embed = new LinkedHashMap<String, Object>();
            embed.put("title", ProposalDigest.TITLE);
            embed.put("description", digest.getSummary());
            embed.put("color", DISCORD_BLUE);
            embed.put("timestamp", digest.getGeneratedAt().toString());
            embed.put("fields", fields);
            return Map.of("embeds", List.of(embed));
        }

        var fields = new ArrayList<Map<String, Object>>();
        for (var field : digest.getFields()) {
            fields.add(Map.of("name", field.getName(), "value", field.getValue()));
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("message", digest.getSummary());
        payload.put("total", digest.getTotalCount());
        payload.put("generated_at", digest.getGeneratedAt().toString());
        payload.put("fields", fields);
        return payload;
    }
}
