package com.inventory.anomaly.forecast;

import com.inventory.anomaly.model.FeatureRow;
import com.inventory.anomaly.model.ForecastPoint;

import java.util.List;

public interface Forecaster {

    /**
     * Fits a model to one product's series, ordered by date.
     *
     * @throws com.inventory.anomaly.engine.ValidationException if the series cannot support a fit
     */
    ForecastModel train(String productId, List<FeatureRow> series);

    /**
     * Predicts the {@code horizonDays} days following the model's last observation.
     */
    List<ForecastPoint> forecast(ForecastModel model, int horizonDays);
}
