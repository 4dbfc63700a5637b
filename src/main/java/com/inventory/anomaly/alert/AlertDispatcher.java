package com.inventory.anomaly.alert;

import com.inventory.anomaly.config.MetricsConfig;
import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.DispatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans one message out to a set of channels. Sends run concurrently; a failing
 * or throwing channel yields a failed outcome for that channel only. The
 * returned map has exactly one entry per requested channel.
 */
@Component
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final Executor executor;
    private final MetricsConfig metricsConfig;

    public AlertDispatcher(@Qualifier("alertDispatchExecutor") Executor executor, MetricsConfig metricsConfig) {
        this.executor = executor;
        this.metricsConfig = metricsConfig;
    }

    public Map<ChannelKind, DispatchOutcome> dispatch(AlertMessage message, Collection<AlertChannel> channels) {
        Map<ChannelKind, DispatchOutcome> outcomes = new EnumMap<>(ChannelKind.class);
        if (channels.isEmpty()) {
            return outcomes;
        }

        Map<ChannelKind, CompletableFuture<DispatchOutcome>> pending = new LinkedHashMap<>();
        for (AlertChannel channel : channels) {
            pending.put(channel.kind(), submit(channel, message));
        }

        pending.forEach((kind, future) -> {
            DispatchOutcome outcome = future.join();
            outcomes.put(kind, outcome);
            metricsConfig.recordDispatch(kind, outcome.isSuccess());
            if (outcome.isSuccess()) {
                log.info("Alert sent: channel={}", kind.getKey());
            } else {
                log.error("Alert failed: channel={}, error={}", kind.getKey(), outcome.getError());
            }
        });
        return outcomes;
    }

    private CompletableFuture<DispatchOutcome> submit(AlertChannel channel, AlertMessage message) {
        try {
            return CompletableFuture.supplyAsync(() -> channel.send(message), executor)
                    .exceptionally(e -> DispatchOutcome.failure(channel.kind(), describe(e)));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    DispatchOutcome.failure(channel.kind(), "dispatch rejected: " + e.getMessage()));
        }
    }

    private static String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
