package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Scored observation produced by anomaly detection. Immutable once built.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"product_id", "date", "consumption", "stock", "anomaly_score", "is_anomaly", "severity"})
public class AnomalyRecord {

    @JsonProperty("product_id")
    String productId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate date;

    double consumption;

    double stock;

    // Normalized to [0, 1]; higher is more anomalous
    @JsonProperty("anomaly_score")
    double anomalyScore;

    @JsonProperty("is_anomaly")
    boolean anomaly;

    Severity severity;
}
