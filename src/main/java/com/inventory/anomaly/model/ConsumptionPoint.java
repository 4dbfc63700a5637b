package com.inventory.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A single (date, consumption) observation of one product's time series.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConsumptionPoint {
    private String productId;
    private LocalDate date;
    private Double value;           // null while missing, before interpolation
}
