package com.inventory.anomaly.config;

import com.inventory.anomaly.engine.RetryPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineConfig {

    // Raw inventory CSV used when a run does not name one
    private String inputSource = "data/inventory_data.csv";

    private String outputDir = "outputs";
    private String modelsDir = "outputs/models";
    private String reportDir = "outputs/reports";

    // Run option defaults, overridable per run
    private boolean enableAlerts = true;
    private boolean enableEmailChannel = false;
    private boolean enableReport = true;

    // Minimum rows for the dataset to be usable; also the per-product warning level
    private int minRecords = 30;

    // Required tasks: initial try + 2 retries, long delay
    private Retry required = new Retry(3, Duration.ofSeconds(60));

    // Optional tasks (alerts, report): initial try + 1 retry, short delay
    private Retry optional = new Retry(2, Duration.ofSeconds(30));

    // Per-product forecasting model training
    private Retry forecastKey = new Retry(2, Duration.ofSeconds(5));

    private IsolationForestSettings isolationForest = new IsolationForestSettings();
    private Forecasting forecasting = new Forecasting();
    private Schedule schedule = new Schedule();
    private Seed seed = new Seed();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Retry {
        private int maxAttempts;
        private Duration delay;

        public RetryPolicy toPolicy() {
            return RetryPolicy.of(maxAttempts, delay);
        }
    }

    @Data
    public static class IsolationForestSettings {
        private int numTrees = 100;
        private int sampleSize = 256;
        // Expected share of anomalies; the top-scoring fraction gets flagged
        private double contamination = 0.1;
        private long seed = 42;
    }

    @Data
    public static class Forecasting {
        private int horizonDays = 7;
        private List<Integer> lags = List.of(1, 7, 30);
        private int minTrainingPoints = 2;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 6 * * *";
    }

    // Synthetic input written at startup when the input source is missing
    @Data
    public static class Seed {
        private boolean enabled = false;
        private int products = 5;
        private String startDate = "2023-01-01";
        private String endDate = "2024-12-31";
        // Chance per row of an injected consumption spike or stock jump
        private double anomalyRate = 0.02;
        private long randomSeed = 42;
    }
}
