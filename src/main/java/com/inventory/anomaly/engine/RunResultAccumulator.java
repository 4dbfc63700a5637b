package com.inventory.anomaly.engine;

import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.DispatchOutcome;
import com.inventory.anomaly.model.RunResult;
import com.inventory.anomaly.model.RunStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects each task's contribution to the run result. Every field is write-once:
 * a second write means a task ran twice outside the executor's retry accounting,
 * and fails fast with {@link IllegalStateException}.
 */
public class RunResultAccumulator {

    private final String runId;
    private final long startedAt;

    private Integer totalRecords;
    private Integer anomaliesDetected;
    private String anomaliesArtifact;
    private String anomaliesOnlyArtifact;
    private String anomalyModelArtifact;
    private Integer modelsTrained;
    private List<String> forecastFailures;
    private String forecastArtifact;
    private Map<ChannelKind, Boolean> alertOutcomes;
    private String reportArtifact;
    private RunResult sealed;

    public RunResultAccumulator(String runId, long startedAt) {
        this.runId = runId;
        this.startedAt = startedAt;
    }

    public synchronized void recordDetection(int totalRecords, int anomaliesDetected) {
        if (totalRecords < 0 || anomaliesDetected < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (anomaliesDetected > totalRecords) {
            throw new IllegalArgumentException("anomaliesDetected (" + anomaliesDetected
                    + ") exceeds totalRecords (" + totalRecords + ")");
        }
        this.totalRecords = writeOnce("total_records", this.totalRecords, totalRecords);
        this.anomaliesDetected = writeOnce("anomalies_detected", this.anomaliesDetected, anomaliesDetected);
    }

    public synchronized void recordDetectionArtifacts(String anomalies, String anomaliesOnly, String model) {
        this.anomaliesArtifact = writeOnce("anomalies_artifact", this.anomaliesArtifact, anomalies);
        this.anomaliesOnlyArtifact = writeOnce("anomalies_only_artifact", this.anomaliesOnlyArtifact, anomaliesOnly);
        this.anomalyModelArtifact = writeOnce("anomaly_model_artifact", this.anomalyModelArtifact, model);
    }

    public synchronized void recordForecasting(int modelsTrained, List<String> failedKeys, String forecastArtifact) {
        this.modelsTrained = writeOnce("models_trained", this.modelsTrained, modelsTrained);
        this.forecastFailures = writeOnce("forecast_failures", this.forecastFailures, List.copyOf(failedKeys));
        this.forecastArtifact = writeOnce("forecast_artifact", this.forecastArtifact, forecastArtifact);
    }

    public synchronized void recordAlertOutcomes(Map<ChannelKind, DispatchOutcome> outcomes) {
        Map<ChannelKind, Boolean> flags = new EnumMap<>(ChannelKind.class);
        outcomes.forEach((kind, outcome) -> flags.put(kind, outcome.isSuccess()));
        this.alertOutcomes = writeOnce("alert_outcomes", this.alertOutcomes, flags);
    }

    public synchronized void recordReport(String reportArtifact) {
        this.reportArtifact = writeOnce("report_artifact", this.reportArtifact, reportArtifact);
    }

    /**
     * Freezes the accumulator into the immutable result returned to the caller.
     */
    public synchronized RunResult seal(RunStatus status, Map<String, TaskState> taskStates) {
        ensureOpen("run result");

        int total = totalRecords != null ? totalRecords : 0;
        int anomalies = anomaliesDetected != null ? anomaliesDetected : 0;

        Map<String, Boolean> outcomes = new LinkedHashMap<>();
        if (alertOutcomes != null) {
            alertOutcomes.forEach((kind, ok) -> outcomes.put(kind.getKey(), ok));
        }

        sealed = RunResult.builder()
                .runId(runId)
                .startedAt(startedAt)
                .finishedAt(System.currentTimeMillis())
                .totalRecords(total)
                .anomaliesDetected(anomalies)
                .anomalyPercentage(percentage(anomalies, total))
                .modelsTrained(modelsTrained != null ? modelsTrained : 0)
                .forecastFailures(forecastFailures != null ? forecastFailures : Collections.emptyList())
                .alertOutcomes(Collections.unmodifiableMap(outcomes))
                .reportArtifact(reportArtifact)
                .anomaliesArtifact(anomaliesArtifact)
                .anomaliesOnlyArtifact(anomaliesOnlyArtifact)
                .anomalyModelArtifact(anomalyModelArtifact)
                .forecastArtifact(forecastArtifact)
                .taskStates(Collections.unmodifiableMap(new LinkedHashMap<>(taskStates)))
                .status(status)
                .build();
        return sealed;
    }

    public synchronized boolean isSealed() {
        return sealed != null;
    }

    static double percentage(int part, int total) {
        if (total == 0) return 0.0;
        return BigDecimal.valueOf(part)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private <V> V writeOnce(String field, V current, V value) {
        ensureOpen(field);
        Objects.requireNonNull(value, field);
        if (current != null) {
            throw new IllegalStateException("Run " + runId + ": field '" + field + "' was already written");
        }
        return value;
    }

    private void ensureOpen(String field) {
        if (sealed != null) {
            throw new IllegalStateException("Run " + runId + " is sealed; cannot write " + field);
        }
    }
}
