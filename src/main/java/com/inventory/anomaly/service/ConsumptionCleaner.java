package com.inventory.anomaly.service;

import com.inventory.anomaly.engine.ValidationException;
import com.inventory.anomaly.model.ConsumptionPoint;
import com.inventory.anomaly.model.InventoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw rows into one clean consumption series per product: first row per date
 * wins, negatives clamp to zero, values outside 1.5 x IQR and missing values are
 * replaced by linear interpolation (nearest valid value at the edges).
 */
@Service
public class ConsumptionCleaner {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionCleaner.class);

    static final double IQR_FACTOR = 1.5;

    /**
     * @param records rows sorted by product, then date
     */
    public List<ConsumptionPoint> clean(List<InventoryRecord> records) {
        Map<String, List<InventoryRecord>> byProduct = new LinkedHashMap<>();
        for (InventoryRecord r : records) {
            byProduct.computeIfAbsent(r.getProductId(), k -> new ArrayList<>()).add(r);
        }

        List<ConsumptionPoint> cleaned = new ArrayList<>(records.size());
        int duplicates = 0;
        int clamped = 0;
        int replaced = 0;

        for (Map.Entry<String, List<InventoryRecord>> entry : byProduct.entrySet()) {
            String product = entry.getKey();
            Set<LocalDate> seen = new HashSet<>();
            List<LocalDate> dates = new ArrayList<>();
            List<Double> values = new ArrayList<>();

            for (InventoryRecord r : entry.getValue()) {
                if (!seen.add(r.getDate())) {
                    duplicates++;
                    continue;
                }
                Double v = r.getConsumption();
                if (v != null && v < 0) {
                    v = 0.0;
                    clamped++;
                }
                dates.add(r.getDate());
                values.add(v);
            }

            Double[] series = values.toArray(new Double[0]);
            replaced += blankOutliers(series);
            interpolate(product, series);

            for (int i = 0; i < series.length; i++) {
                cleaned.add(ConsumptionPoint.builder()
                        .productId(product)
                        .date(dates.get(i))
                        .value(series[i])
                        .build());
            }
        }

        log.info("Cleaned consumption: {} point(s), {} duplicate date(s) dropped, {} negative(s) clamped, "
                + "{} outlier(s) replaced", cleaned.size(), duplicates, clamped, replaced);
        return cleaned;
    }

    /**
     * Nulls out values outside [Q1 - 1.5 IQR, Q3 + 1.5 IQR].
     *
     * @return number of values removed
     */
    static int blankOutliers(Double[] series) {
        double[] present = Arrays.stream(series).filter(v -> v != null).mapToDouble(Double::doubleValue)
                .sorted().toArray();
        if (present.length < 4) return 0;

        double q1 = quantile(present, 0.25);
        double q3 = quantile(present, 0.75);
        double iqr = q3 - q1;
        double lower = q1 - IQR_FACTOR * iqr;
        double upper = q3 + IQR_FACTOR * iqr;

        int removed = 0;
        for (int i = 0; i < series.length; i++) {
            if (series[i] != null && (series[i] < lower || series[i] > upper)) {
                series[i] = null;
                removed++;
            }
        }
        return removed;
    }

    // Linear interpolation between order statistics
    static double quantile(double[] sorted, double q) {
        double pos = (sorted.length - 1) * q;
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    static void interpolate(String product, Double[] series) {
        int first = -1;
        for (int i = 0; i < series.length; i++) {
            if (series[i] != null) {
                first = i;
                break;
            }
        }
        if (first < 0) {
            throw new ValidationException("Product " + product + " has no usable consumption values");
        }

        for (int i = 0; i < first; i++) series[i] = series[first];

        int prev = first;
        for (int i = first + 1; i < series.length; i++) {
            if (series[i] == null) continue;
            int gap = i - prev;
            for (int j = prev + 1; j < i; j++) {
                series[j] = series[prev] + (series[i] - series[prev]) * (j - prev) / gap;
            }
            prev = i;
        }
        for (int i = prev + 1; i < series.length; i++) series[i] = series[prev];
    }
}
