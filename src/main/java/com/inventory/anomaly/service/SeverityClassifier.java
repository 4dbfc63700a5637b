package com.inventory.anomaly.service;

import com.inventory.anomaly.config.SeverityThresholdConfig;
import com.inventory.anomaly.config.SeverityThresholdConfig.Thresholds;
import com.inventory.anomaly.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Maps a normalized anomaly score to a severity tier. Lower bounds are inclusive:
 * {@code score >= critical} is CRITICAL, {@code score >= high} is HIGH,
 * {@code score >= minAlertable} is MEDIUM, anything else (including NaN) is NONE.
 *
 * <p>With the default policy ({@code minAlertable == high == 0.70}) the MEDIUM band is
 * empty, so every alert-worthy record is at least HIGH.
 */
@Component
public class SeverityClassifier {

    private final SeverityThresholdConfig config;

    public SeverityClassifier(SeverityThresholdConfig config) {
        this.config = config;
    }

    public Severity classify(double score) {
        return classify(score, config.snapshot());
    }

    public Severity classify(double score, Thresholds thresholds) {
        if (score >= thresholds.getCritical()) return Severity.CRITICAL;
        if (score >= thresholds.getHigh()) return Severity.HIGH;
        if (score >= thresholds.getMinAlertable()) return Severity.MEDIUM;
        return Severity.NONE;
    }

    public Thresholds currentThresholds() {
        return config.snapshot();
    }
}
