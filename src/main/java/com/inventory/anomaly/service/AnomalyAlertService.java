package com.inventory.anomaly.service;

import com.inventory.anomaly.alert.AlertChannel;
import com.inventory.anomaly.alert.AlertDispatcher;
import com.inventory.anomaly.alert.AlertMessageFormatter;
import com.inventory.anomaly.model.AnomalyRecord;
import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.DispatchOutcome;
import com.inventory.anomaly.model.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the alert-worthy records of a run and the channels enabled for it,
 * then hands both to the dispatcher.
 */
@Service
public class AnomalyAlertService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAlertService.class);

    private final List<AlertChannel> channels;
    private final AlertMessageFormatter formatter;
    private final AlertDispatcher dispatcher;
    private final SeverityClassifier classifier;

    public AnomalyAlertService(List<AlertChannel> channels, AlertMessageFormatter formatter,
                               AlertDispatcher dispatcher, SeverityClassifier classifier) {
        this.channels = channels;
        this.formatter = formatter;
        this.dispatcher = dispatcher;
        this.classifier = classifier;
    }

    public Map<ChannelKind, DispatchOutcome> sendAlerts(List<AnomalyRecord> records, RunOptions options) {
        double minScore = classifier.currentThresholds().getMinAlertable();
        List<AnomalyRecord> alertable = records.stream()
                .filter(AnomalyRecord::isAnomaly)
                .filter(r -> r.getAnomalyScore() >= minScore)
                .toList();

        if (alertable.isEmpty()) {
            log.info("No anomalies at or above score {}; no alert sent", minScore);
            return new EnumMap<>(ChannelKind.class);
        }

        List<AlertChannel> enabled = enabledChannels(options);
        if (enabled.isEmpty()) {
            log.info("{} alert-worthy anomalies but no channel is configured", alertable.size());
            return new EnumMap<>(ChannelKind.class);
        }

        log.info("Sending alert for {} anomalies to {}", alertable.size(),
                enabled.stream().map(c -> c.kind().getKey()).toList());
        return dispatcher.dispatch(formatter.format(alertable), enabled);
    }

    /**
     * Configuration state of every known channel, regardless of run options.
     */
    public Map<ChannelKind, Boolean> channelStatus() {
        Map<ChannelKind, Boolean> status = new EnumMap<>(ChannelKind.class);
        for (ChannelKind kind : ChannelKind.values()) {
            status.put(kind, false);
        }
        channels.forEach(c -> status.put(c.kind(), c.isConfigured()));
        return status;
    }

    public List<AlertChannel> enabledChannels(RunOptions options) {
        return channels.stream()
                .filter(AlertChannel::isConfigured)
                .filter(c -> c.kind() != ChannelKind.EMAIL || options.isEnableEmailChannel())
                .toList();
    }
}
