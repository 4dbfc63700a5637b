package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller overrides for a pipeline run. Absent fields fall back to configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Optional overrides for a pipeline run")
public class RunRequest {

    @JsonProperty("input_source")
    @Schema(description = "Path of the raw inventory CSV", example = "data/inventory_data.csv")
    private String inputSource;

    @JsonProperty("enable_alerts")
    @Schema(description = "Run the alert branch", example = "true")
    private Boolean enableAlerts;

    @JsonProperty("enable_email_channel")
    @Schema(description = "Include the email channel when alerting", example = "false")
    private Boolean enableEmailChannel;

    @JsonProperty("enable_report")
    @Schema(description = "Run the report branch", example = "true")
    private Boolean enableReport;
}
