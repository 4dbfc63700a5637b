package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    SUCCEEDED,
    FAILED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
