package com.inventory.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts")
public class AlertChannelConfig {

    private String title = "Inventory Anomaly Alert";

    // Records listed per message; the full list belongs in the report
    private int maxListedAnomalies = 20;

    // Channel sends within one dispatch run concurrently on this many threads
    private int dispatchThreads = 3;

    private Duration webhookTimeout = Duration.ofSeconds(10);

    private Webhook discord = new Webhook();
    private Webhook teams = new Webhook();
    private Email email = new Email();

    @Data
    public static class Webhook {
        private String webhookUrl;

        public boolean isConfigured() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }

    @Data
    public static class Email {
        private String from;
        private List<String> to = new ArrayList<>();
        private String subject = "Anomaly Alert - Inventory Anomaly Detector";

        public boolean isConfigured() {
            return from != null && !from.isBlank() && to != null && !to.isEmpty();
        }
    }
}
