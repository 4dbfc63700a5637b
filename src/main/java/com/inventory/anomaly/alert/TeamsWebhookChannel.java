package com.inventory.anomaly.alert;

import com.inventory.anomaly.config.AlertChannelConfig;
import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.ChannelKind;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Microsoft Teams incoming webhook, legacy MessageCard format. The card text
 * accepts a subset of HTML, so the rich rendering is sent.
 */
@Component
public class TeamsWebhookChannel extends WebhookAlertChannel {

    private final AlertChannelConfig config;

    public TeamsWebhookChannel(@Qualifier("webhookRestClient") RestClient restClient, AlertChannelConfig config) {
        super(restClient);
        this.config = config;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.TEAMS;
    }

    @Override
    protected String webhookUrl() {
        return config.getTeams().getWebhookUrl();
    }

    @Override
    protected Map<String, Object> payload(AlertMessage message) {
        Map<String, Object> card = new LinkedHashMap<>();
        card.put("@type", "MessageCard");
        card.put("@context", "http://schema.org/extensions");
        card.put("summary", message.getTitle());
        card.put("themeColor", "FF0000");
        card.put("title", message.getTitle());
        card.put("text", message.getHtml() != null ? message.getHtml() : message.getText());
        return card;
    }
}
