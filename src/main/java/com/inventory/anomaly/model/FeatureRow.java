package com.inventory.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureRow {
    private String productId;
    private LocalDate date;
    private double value;

    // lag (days) -> value that many observations earlier; null for the first rows of a series
    private Map<Integer, Double> lags;
}
