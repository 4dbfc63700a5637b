package com.inventory.anomaly.service;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.model.ConsumptionPoint;
import com.inventory.anomaly.model.FeatureRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.inventory.anomaly.testutil.TestDataFactory.START;
import static org.assertj.core.api.Assertions.assertThat;

class LagFeatureBuilderTest {

    @Test
    void build_lagsCountObservationsWithinProduct() {
        PipelineConfig config = new PipelineConfig();
        config.getForecasting().setLags(List.of(1, 3));
        LagFeatureBuilder builder = new LagFeatureBuilder(config);

        List<ConsumptionPoint> points = new ArrayList<>();
        for (int i = 0; i < 4; i++) points.add(point("P1", i, 10.0 * (i + 1)));
        for (int i = 0; i < 2; i++) points.add(point("P2", i, 100.0 + i));

        List<FeatureRow> rows = builder.build(points);

        assertThat(rows).hasSize(6);
        assertThat(rows.get(0).getLags()).containsEntry(1, null).containsEntry(3, null);
        assertThat(rows.get(1).getLags()).containsEntry(1, 10.0).containsEntry(3, null);
        assertThat(rows.get(3).getLags()).containsEntry(1, 30.0).containsEntry(3, 10.0);
        assertThat(rows.get(3).getValue()).isEqualTo(40.0);

        // P2 starts its own history
        assertThat(rows.get(4).getLags()).containsEntry(1, null);
        assertThat(rows.get(5).getLags()).containsEntry(1, 100.0);
    }

    private static ConsumptionPoint point(String productId, int day, double value) {
        return ConsumptionPoint.builder().productId(productId).date(START.plusDays(day)).value(value).build();
    }
}
