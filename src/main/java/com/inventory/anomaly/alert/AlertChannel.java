package com.inventory.anomaly.alert;

import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.DispatchOutcome;

/**
 * A notification medium. Implementations are stateless apart from their configuration
 * and may be called concurrently with other channels.
 */
public interface AlertChannel {

    ChannelKind kind();

    /**
     * Whether the channel has everything it needs to send (endpoint, recipients).
     * Unconfigured channels are left out of a dispatch rather than reported as failed.
     */
    boolean isConfigured();

    /**
     * Delivers the message.
     *
     * @return a successful outcome for this channel
     * @throws ChannelSendException if the medium rejected or could not receive the message
     */
    DispatchOutcome send(AlertMessage message);
}
