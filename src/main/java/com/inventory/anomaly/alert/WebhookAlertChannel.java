package com.inventory.anomaly.alert;

import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.DispatchOutcome;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Posts a JSON payload to an incoming-webhook URL. Subclasses supply the URL and
 * the medium-specific payload shape.
 */
public abstract class WebhookAlertChannel implements AlertChannel {

    private final RestClient restClient;

    protected WebhookAlertChannel(RestClient restClient) {
        this.restClient = restClient;
    }

    protected abstract String webhookUrl();

    protected abstract Map<String, Object> payload(AlertMessage message);

    @Override
    public boolean isConfigured() {
        String url = webhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public DispatchOutcome send(AlertMessage message) {
        if (!isConfigured()) {
            throw new ChannelSendException(kind(), kind().getKey() + " webhook URL is not configured", null);
        }
        try {
            restClient.post()
                    .uri(webhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload(message))
                    .retrieve()
                    .toBodilessEntity();
            return DispatchOutcome.success(kind());
        } catch (RestClientException e) {
            throw new ChannelSendException(kind(), kind().getKey() + " webhook call failed: " + e.getMessage(), e);
        }
    }

    protected static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        return text.substring(0, maxLength - 3) + "...";
    }
}
