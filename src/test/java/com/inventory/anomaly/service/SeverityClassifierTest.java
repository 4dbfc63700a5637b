package com.inventory.anomaly.service;

import com.inventory.anomaly.config.SeverityThresholdConfig;
import com.inventory.anomaly.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityClassifierTest {

    private SeverityThresholdConfig config;
    private SeverityClassifier classifier;

    @BeforeEach
    void setUp() {
        config = new SeverityThresholdConfig();
        classifier = new SeverityClassifier(config);
    }

    @Test
    void classify_defaultPolicy_boundariesInclusive() {
        assertThat(classifier.classify(0.85)).isEqualTo(Severity.CRITICAL);
        assertThat(classifier.classify(0.99)).isEqualTo(Severity.CRITICAL);
        assertThat(classifier.classify(0.8499)).isEqualTo(Severity.HIGH);
        assertThat(classifier.classify(0.70)).isEqualTo(Severity.HIGH);
        assertThat(classifier.classify(0.6999)).isEqualTo(Severity.NONE);
        assertThat(classifier.classify(0.0)).isEqualTo(Severity.NONE);
    }

    @Test
    void classify_defaultPolicy_neverProducesMedium() {
        for (int i = 0; i <= 100; i++) {
            assertThat(classifier.classify(i / 100.0)).isNotEqualTo(Severity.MEDIUM);
        }
    }

    @Test
    void classify_nan_isNone() {
        assertThat(classifier.classify(Double.NaN)).isEqualTo(Severity.NONE);
    }

    @Test
    void classify_lowerMinAlertable_opensMediumBand() {
        config.apply(0.60, 0.70, 0.85);

        assertThat(classifier.classify(0.60)).isEqualTo(Severity.MEDIUM);
        assertThat(classifier.classify(0.65)).isEqualTo(Severity.MEDIUM);
        assertThat(classifier.classify(0.59)).isEqualTo(Severity.NONE);
        assertThat(classifier.currentThresholds().getMinAlertable()).isEqualTo(0.60);
    }

    @Test
    void apply_unorderedBounds_rejectedAndPreviousPolicyKept() {
        assertThatThrownBy(() -> config.apply(0.75, 0.70, 0.85))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minAlertable");
        assertThatThrownBy(() -> config.apply(0.5, 0.9, 0.9))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.apply(-0.1, 0.7, 0.85))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(classifier.classify(0.85)).isEqualTo(Severity.CRITICAL);
        assertThat(classifier.currentThresholds().getHigh()).isEqualTo(0.70);
    }

    @Test
    void apply_nonFiniteBound_rejectedAndClassificationUnchanged() {
        assertThatThrownBy(() -> config.apply(0.70, Double.NaN, 0.85))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
        assertThatThrownBy(() -> config.apply(Double.NaN, 0.70, 0.85))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.apply(0.70, 0.80, Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(classifier.classify(0.80)).isEqualTo(Severity.HIGH);
        assertThat(classifier.classify(0.70)).isEqualTo(Severity.HIGH);
    }
}
