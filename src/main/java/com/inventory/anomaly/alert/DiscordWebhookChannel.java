package com.inventory.anomaly.alert;

import com.inventory.anomaly.config.AlertChannelConfig;
import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.ChannelKind;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DiscordWebhookChannel extends WebhookAlertChannel {

    static final int COLOR_RED = 15158332;

    // Discord rejects embed descriptions above this length
    static final int MAX_DESCRIPTION = 4096;

    private final AlertChannelConfig config;

    public DiscordWebhookChannel(@Qualifier("webhookRestClient") RestClient restClient, AlertChannelConfig config) {
        super(restClient);
        this.config = config;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.DISCORD;
    }

    @Override
    protected String webhookUrl() {
        return config.getDiscord().getWebhookUrl();
    }

    @Override
    protected Map<String, Object> payload(AlertMessage message) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", message.getTitle());
        embed.put("description", truncate("```\n" + message.getText() + "\n```", MAX_DESCRIPTION));
        embed.put("color", COLOR_RED);
        embed.put("timestamp", Instant.now().toString());
        return Map.of("embeds", List.of(embed));
    }
}
