package com.inventory.anomaly.engine;

import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.DispatchOutcome;
import com.inventory.anomaly.model.RunResult;
import com.inventory.anomaly.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunResultAccumulatorTest {

    @Test
    void seal_percentageRoundsHalfUpToTwoDecimals() {
        RunResultAccumulator acc = new RunResultAccumulator("run-1", 1000L);
        acc.recordDetection(3655, 366);

        RunResult result = acc.seal(RunStatus.SUCCEEDED, Map.of());

        assertThat(result.getTotalRecords()).isEqualTo(3655);
        assertThat(result.getAnomaliesDetected()).isEqualTo(366);
        assertThat(result.getAnomalyPercentage()).isEqualTo(10.01);
    }

    @Test
    void percentage_zeroTotal_isZero() {
        assertThat(RunResultAccumulator.percentage(0, 0)).isEqualTo(0.0);
        assertThat(RunResultAccumulator.percentage(1, 8)).isEqualTo(12.5);
        assertThat(RunResultAccumulator.percentage(1, 3)).isEqualTo(33.33);
    }

    @Test
    void recordDetection_moreAnomaliesThanRecords_rejected() {
        RunResultAccumulator acc = new RunResultAccumulator("run-1", 0L);

        assertThatThrownBy(() -> acc.recordDetection(10, 11)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void doubleWrite_isFatal() {
        RunResultAccumulator acc = new RunResultAccumulator("run-1", 0L);
        acc.recordReport("outputs/reports/a.html");

        assertThatThrownBy(() -> acc.recordReport("outputs/reports/b.html"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("report_artifact");
    }

    @Test
    void writeAfterSeal_isFatal() {
        RunResultAccumulator acc = new RunResultAccumulator("run-1", 0L);
        acc.seal(RunStatus.FAILED, Map.of());

        assertThat(acc.isSealed()).isTrue();
        assertThatThrownBy(() -> acc.recordDetection(1, 0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> acc.seal(RunStatus.FAILED, Map.of())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void seal_unwrittenFields_defaultToEmpty() {
        RunResultAccumulator acc = new RunResultAccumulator("run-1", 0L);

        RunResult result = acc.seal(RunStatus.FAILED, Map.of("load_data", TaskState.FAILED));

        assertThat(result.getAlertOutcomes()).isEmpty();
        assertThat(result.getForecastFailures()).isEmpty();
        assertThat(result.getReportArtifact()).isNull();
        assertThat(result.getModelsTrained()).isZero();
        assertThat(result.getTaskStates()).containsEntry("load_data", TaskState.FAILED);
        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void recordAlertOutcomes_keyedByChannelKey() {
        RunResultAccumulator acc = new RunResultAccumulator("run-1", 0L);
        Map<ChannelKind, DispatchOutcome> outcomes = new EnumMap<>(ChannelKind.class);
        outcomes.put(ChannelKind.DISCORD, DispatchOutcome.success(ChannelKind.DISCORD));
        outcomes.put(ChannelKind.TEAMS, DispatchOutcome.failure(ChannelKind.TEAMS, "502"));
        acc.recordAlertOutcomes(outcomes);
        acc.recordForecasting(4, List.of("P5"), "outputs/forecast_7d.csv");

        RunResult result = acc.seal(RunStatus.SUCCEEDED, Map.of());

        assertThat(result.getAlertOutcomes()).containsExactly(
                Map.entry("discord", true), Map.entry("teams", false));
        assertThat(result.getModelsTrained()).isEqualTo(4);
        assertThat(result.getForecastFailures()).containsExactly("P5");
    }
}
