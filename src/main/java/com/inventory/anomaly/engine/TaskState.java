package com.inventory.anomaly.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a task within one run.
 * PENDING -> RUNNING -> SUCCEEDED | FAILED, or PENDING -> SKIPPED.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
