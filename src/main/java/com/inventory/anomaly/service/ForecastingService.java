package com.inventory.anomaly.service;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.engine.RetryExhaustedException;
import com.inventory.anomaly.engine.RetryPolicy;
import com.inventory.anomaly.engine.RetryPolicyEngine;
import com.inventory.anomaly.forecast.ForecastModel;
import com.inventory.anomaly.forecast.Forecaster;
import com.inventory.anomaly.forecast.ForecastingResult;
import com.inventory.anomaly.model.FeatureRow;
import com.inventory.anomaly.model.ForecastPoint;
import com.inventory.anomaly.repository.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trains one forecasting model per product. Each product gets its own retry budget;
 * a product that exhausts it is recorded as failed and the others carry on.
 * Only when no product could be trained does the whole stage fail.
 */
@Service
public class ForecastingService {

    private static final Logger log = LoggerFactory.getLogger(ForecastingService.class);

    static final String FORECAST_FILE = "forecast_7d.csv";

    private final Forecaster forecaster;
    private final RetryPolicyEngine retryEngine;
    private final ArtifactStore artifactStore;
    private final PipelineConfig config;

    public ForecastingService(Forecaster forecaster, RetryPolicyEngine retryEngine,
                              ArtifactStore artifactStore, PipelineConfig config) {
        this.forecaster = forecaster;
        this.retryEngine = retryEngine;
        this.artifactStore = artifactStore;
        this.config = config;
    }

    public ForecastingResult trainAll(List<FeatureRow> rows) throws IOException {
        Map<String, List<FeatureRow>> byProduct = new LinkedHashMap<>();
        for (FeatureRow row : rows) {
            byProduct.computeIfAbsent(row.getProductId(), k -> new ArrayList<>()).add(row);
        }
        if (byProduct.isEmpty()) {
            throw new IllegalStateException("No product series to train on");
        }

        RetryPolicy perKey = config.getForecastKey().toPolicy();
        Map<String, ForecastModel> models = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<String, List<FeatureRow>> entry : byProduct.entrySet()) {
            String product = entry.getKey();
            try {
                ForecastModel model = retryEngine.executeWithRetry(
                        () -> forecaster.train(product, entry.getValue()), perKey);
                models.put(product, model);
            } catch (RetryExhaustedException e) {
                failed.add(product);
                log.warn("Forecast model for product {} not trained: {}", product, e.getMessage());
            }
        }

        if (models.isEmpty()) {
            throw new IllegalStateException("Forecasting failed for all " + failed.size() + " product(s)");
        }

        int horizon = config.getForecasting().getHorizonDays();
        List<ForecastPoint> forecast = new ArrayList<>();
        for (ForecastModel model : models.values()) {
            forecast.addAll(forecaster.forecast(model, horizon));
            artifactStore.writeJson(Path.of(config.getModelsDir(), modelFileName(model.getProductId())), model);
        }
        String artifact = artifactStore.writeCsv(Path.of(config.getOutputDir(), FORECAST_FILE),
                forecast, ForecastPoint.class);

        log.info("Forecast models trained: {}/{} product(s){}", models.size(), byProduct.size(),
                failed.isEmpty() ? "" : ", failed: " + failed);
        return ForecastingResult.builder()
                .models(models)
                .failedProducts(List.copyOf(failed))
                .forecast(forecast)
                .forecastArtifact(artifact)
                .build();
    }

    static String modelFileName(String productId) {
        return "forecast_model_" + productId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}
