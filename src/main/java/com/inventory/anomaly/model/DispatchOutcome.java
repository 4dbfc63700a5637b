package com.inventory.anomaly.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DispatchOutcome {
    ChannelKind channel;
    boolean success;
    String error;

    public static DispatchOutcome success(ChannelKind channel) {
        return new DispatchOutcome(channel, true, null);
    }

    public static DispatchOutcome failure(ChannelKind channel, String error) {
        return new DispatchOutcome(channel, false, error);
    }
}
