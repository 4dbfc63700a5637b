package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@JsonPropertyOrder({"product_id", "ds", "yhat", "yhat_lower", "yhat_upper"})
public class ForecastPoint {

    @JsonProperty("product_id")
    String productId;

    @JsonProperty("ds")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate date;

    @JsonProperty("yhat")
    double predicted;

    @JsonProperty("yhat_lower")
    double lower;

    @JsonProperty("yhat_upper")
    double upper;
}
