package com.inventory.anomaly.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Severity policy over normalized anomaly scores. Lower bounds are inclusive.
 * Values can be changed at runtime through the config API; readers take a
 * {@link #snapshot()} so one classification never mixes old and new bounds.
 */
@Configuration
@ConfigurationProperties(prefix = "severity")
public class SeverityThresholdConfig {

    // Scores below this are not alert-worthy (NONE)
    private double minAlertable = 0.70;

    private double high = 0.70;

    private double critical = 0.85;

    public synchronized Thresholds snapshot() {
        return new Thresholds(minAlertable, high, critical);
    }

    /**
     * Replaces all three bounds at once.
     *
     * @throws IllegalArgumentException if a bound is not finite or the bounds are not ordered within [0, 1]
     */
    public synchronized void apply(double minAlertable, double high, double critical) {
        String problem = validate(minAlertable, high, critical);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        this.minAlertable = minAlertable;
        this.high = high;
        this.critical = critical;
    }

    public static String validate(double minAlertable, double high, double critical) {
        if (!Double.isFinite(minAlertable) || !Double.isFinite(high) || !Double.isFinite(critical)) {
            return "thresholds must be finite numbers";
        }
        if (minAlertable < 0 || critical > 1) return "thresholds must lie within [0, 1]";
        if (minAlertable > high) return "minAlertable must be <= high";
        if (high >= critical) return "high must be < critical";
        return null;
    }

    // Binder setters
    public synchronized double getMinAlertable() { return minAlertable; }
    public synchronized void setMinAlertable(double minAlertable) { this.minAlertable = minAlertable; }
    public synchronized double getHigh() { return high; }
    public synchronized void setHigh(double high) { this.high = high; }
    public synchronized double getCritical() { return critical; }
    public synchronized void setCritical(double critical) { this.critical = critical; }

    @Value
    public static class Thresholds {
        double minAlertable;
        double high;
        double critical;
    }
}
