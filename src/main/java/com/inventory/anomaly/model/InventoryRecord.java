package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One raw row of the inventory input file: a product's stock level and
 * consumption on a given day. Column names from the legacy Portuguese export
 * are accepted as aliases.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"date", "product_id", "stock", "consumption"})
public class InventoryRecord {

    @JsonProperty("date")
    @JsonAlias("data")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    @JsonProperty("product_id")
    @JsonAlias("produto_id")
    private String productId;

    @JsonProperty("stock")
    @JsonAlias("estoque")
    private Double stock;

    @JsonProperty("consumption")
    @JsonAlias("consumo")
    private Double consumption;
}
