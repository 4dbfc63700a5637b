package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inventory.anomaly.engine.TaskState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Outcome of one end-to-end pipeline run")
public class RunResult {

    @JsonProperty("run_id")
    @Schema(description = "Run identifier", example = "run-20260112-060000-3f9a")
    String runId;

    @JsonProperty("started_at")
    @Schema(description = "Run start, epoch milliseconds", example = "1768197600000")
    long startedAt;

    @JsonProperty("finished_at")
    @Schema(description = "Run end, epoch milliseconds", example = "1768197663000")
    long finishedAt;

    @JsonProperty("total_records")
    @Schema(description = "Scored daily observations", example = "3655")
    int totalRecords;

    @JsonProperty("anomalies_detected")
    @Schema(description = "Observations flagged as anomalous", example = "366")
    int anomaliesDetected;

    @JsonProperty("anomaly_percentage")
    @Schema(description = "anomalies_detected / total_records * 100, rounded half-up to 2 decimals", example = "10.01")
    double anomalyPercentage;

    @JsonProperty("models_trained")
    @Schema(description = "Per-product forecasting models trained successfully", example = "5")
    int modelsTrained;

    @JsonProperty("forecast_failures")
    @Schema(description = "Products whose forecasting model could not be trained")
    List<String> forecastFailures;

    @JsonProperty("alert_outcomes")
    @Schema(description = "Channel key -> delivery success. Empty when alerts were skipped or disabled")
    Map<String, Boolean> alertOutcomes;

    @JsonProperty("report_artifact")
    @Schema(description = "Location of the rendered report, absent if not generated")
    String reportArtifact;

    @JsonProperty("anomalies_artifact")
    @Schema(description = "Location of the full scored dataset")
    String anomaliesArtifact;

    @JsonProperty("anomalies_only_artifact")
    @Schema(description = "Location of the flagged-only subset")
    String anomaliesOnlyArtifact;

    @JsonProperty("anomaly_model_artifact")
    @Schema(description = "Location of the persisted outlier model")
    String anomalyModelArtifact;

    @JsonProperty("forecast_artifact")
    @Schema(description = "Location of the per-product forecast table")
    String forecastArtifact;

    @JsonProperty("task_states")
    @Schema(description = "Terminal state of every declared task")
    Map<String, TaskState> taskStates;

    @Schema(description = "Terminal run status", allowableValues = {"succeeded", "failed"})
    RunStatus status;
}
