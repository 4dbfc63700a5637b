package com.inventory.anomaly.alert;

import com.inventory.anomaly.model.ChannelKind;

public class ChannelSendException extends RuntimeException {

    private final ChannelKind channel;

    public ChannelSendException(ChannelKind channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public ChannelKind getChannel() {
        return channel;
    }
}
