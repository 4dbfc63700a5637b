package com.inventory.anomaly.service;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.model.ConsumptionPoint;
import com.inventory.anomaly.model.FeatureRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds lagged consumption values within each product's series. Lags count
 * observations, not calendar days, and are null where the series is too short.
 */
@Service
public class LagFeatureBuilder {

    private static final Logger log = LoggerFactory.getLogger(LagFeatureBuilder.class);

    private final PipelineConfig config;

    public LagFeatureBuilder(PipelineConfig config) {
        this.config = config;
    }

    public List<FeatureRow> build(List<ConsumptionPoint> points) {
        List<Integer> lags = config.getForecasting().getLags();
        List<FeatureRow> rows = new ArrayList<>(points.size());

        String currentProduct = null;
        List<Double> history = new ArrayList<>();
        for (ConsumptionPoint p : points) {
            if (!p.getProductId().equals(currentProduct)) {
                currentProduct = p.getProductId();
                history.clear();
            }

            Map<Integer, Double> lagValues = new LinkedHashMap<>();
            for (int lag : lags) {
                int idx = history.size() - lag;
                lagValues.put(lag, idx >= 0 ? history.get(idx) : null);
            }
            rows.add(FeatureRow.builder()
                    .productId(p.getProductId())
                    .date(p.getDate())
                    .value(p.getValue())
                    .lags(lagValues)
                    .build());
            history.add(p.getValue());
        }

        log.info("Created {} lag feature(s) {} over {} row(s)", lags.size(), lags, rows.size());
        return rows;
    }
}
