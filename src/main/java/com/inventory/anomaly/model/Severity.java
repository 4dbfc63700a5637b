package com.inventory.anomaly.model;

/**
 * Severity tier derived from a normalized anomaly score.
 * Declared in ascending order so {@link #compareTo} reflects urgency.
 */
public enum Severity {
    NONE("None"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAlertable() {
        return this != NONE;
    }
}
