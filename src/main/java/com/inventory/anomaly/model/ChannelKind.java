package com.inventory.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Notification media an alert can be fanned out to.
 */
public enum ChannelKind {
    DISCORD("discord"),
    TEAMS("teams"),
    EMAIL("email");

    private final String key;

    ChannelKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static ChannelKind fromKey(String key) {
        for (ChannelKind kind : values()) {
            if (kind.key.equalsIgnoreCase(key)) return kind;
        }
        throw new IllegalArgumentException("Unknown channel kind: " + key);
    }
}
