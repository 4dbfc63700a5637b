package com.inventory.anomaly.forecast;

import com.inventory.anomaly.model.ForecastPoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of training every product's model. {@code failedProducts} is the
 * partial-training record: keys whose retries were exhausted.
 */
@Value
@Builder
public class ForecastingResult {
    Map<String, ForecastModel> models;
    List<String> failedProducts;
    List<ForecastPoint> forecast;
    String forecastArtifact;

    public int modelsTrained() {
        return models.size();
    }
}
