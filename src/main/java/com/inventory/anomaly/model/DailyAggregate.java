package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Daily per-product roll-up of the raw inventory rows. Feeds the outlier scorer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyAggregate {

    @JsonProperty("product_id")
    private String productId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    @JsonProperty("consumption_mean")
    private double consumptionMean;

    @JsonProperty("consumption_sum")
    private double consumptionSum;

    @JsonProperty("consumption_min")
    private double consumptionMin;

    @JsonProperty("consumption_max")
    private double consumptionMax;

    @JsonProperty("stock_mean")
    private double stockMean;

    @JsonProperty("stock_min")
    private double stockMin;

    @JsonProperty("stock_max")
    private double stockMax;

    @JsonProperty("record_count")
    private int recordCount;
}
