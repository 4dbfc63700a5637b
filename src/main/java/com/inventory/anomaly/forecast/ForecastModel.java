package com.inventory.anomaly.forecast;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Fitted per-product consumption model: linear trend over days since {@code origin},
 * scaled by a multiplicative day-of-week factor.
 */
@Value
@Builder
@Jacksonized
public class ForecastModel {

    @JsonProperty("product_id")
    String productId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate origin;

    @JsonProperty("last_observed")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate lastObserved;

    double intercept;

    double slope;

    // Index 0 = Monday ... 6 = Sunday; averages to 1.0
    @JsonProperty("weekly_factors")
    double[] weeklyFactors;

    @JsonProperty("residual_std")
    double residualStd;

    @JsonProperty("training_points")
    int trainingPoints;

    public double predict(LocalDate date) {
        long t = date.toEpochDay() - origin.toEpochDay();
        double trend = intercept + slope * t;
        return trend * weeklyFactors[date.getDayOfWeek().getValue() - 1];
    }
}
