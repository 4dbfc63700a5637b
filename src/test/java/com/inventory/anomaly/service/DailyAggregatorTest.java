package com.inventory.anomaly.service;

import com.inventory.anomaly.model.DailyAggregate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.inventory.anomaly.testutil.TestDataFactory.START;
import static com.inventory.anomaly.testutil.TestDataFactory.inventory;
import static org.assertj.core.api.Assertions.assertThat;

class DailyAggregatorTest {

    private final DailyAggregator aggregator = new DailyAggregator();

    @Test
    void aggregate_groupsByProductAndDay() {
        List<DailyAggregate> rows = aggregator.aggregate(List.of(
                inventory("P2", START, 300.0, 30.0),
                inventory("P1", START.plusDays(1), 80.0, 8.0),
                inventory("P1", START, 100.0, 10.0),
                inventory("P1", START, 120.0, 20.0)));

        assertThat(rows).hasSize(3);
        DailyAggregate first = rows.get(0);
        assertThat(first.getProductId()).isEqualTo("P1");
        assertThat(first.getDate()).isEqualTo(START);
        assertThat(first.getConsumptionMean()).isEqualTo(15.0);
        assertThat(first.getConsumptionSum()).isEqualTo(30.0);
        assertThat(first.getConsumptionMin()).isEqualTo(10.0);
        assertThat(first.getConsumptionMax()).isEqualTo(20.0);
        assertThat(first.getStockMean()).isEqualTo(110.0);
        assertThat(first.getRecordCount()).isEqualTo(2);
        assertThat(rows.get(1).getDate()).isEqualTo(START.plusDays(1));
        assertThat(rows.get(2).getProductId()).isEqualTo("P2");
    }

    @Test
    void aggregate_missingCellsIgnored() {
        List<DailyAggregate> rows = aggregator.aggregate(List.of(
                inventory("P1", START, null, 10.0),
                inventory("P1", START, 50.0, null)));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getConsumptionMean()).isEqualTo(10.0);
        assertThat(rows.get(0).getStockMean()).isEqualTo(50.0);
        assertThat(rows.get(0).getRecordCount()).isEqualTo(2);
    }

    @Test
    void aggregate_columnWithoutValues_reportsZero() {
        List<DailyAggregate> rows = aggregator.aggregate(List.of(inventory("P1", START, 50.0, null)));

        assertThat(rows.get(0).getConsumptionMean()).isZero();
        assertThat(rows.get(0).getConsumptionMax()).isZero();
    }
}
