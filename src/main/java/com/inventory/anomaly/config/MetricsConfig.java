package com.inventory.anomaly.config;

import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastRunAnomalies;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastRunAnomalies = registry.gauge("pipeline.last_run.anomalies", new AtomicInteger(0));
    }

    public void recordTaskAttempt(String taskId, boolean success) {
        Counter.builder("pipeline.task.attempts")
                .tag("task", taskId)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordTaskSkipped(String taskId) {
        Counter.builder("pipeline.task.skipped")
                .tag("task", taskId)
                .register(registry)
                .increment();
    }

    public void recordRun(RunStatus status, int anomalies, double anomalyPercentage) {
        Counter.builder("pipeline.run.count")
                .tag("status", status.toJson())
                .register(registry)
                .increment();

        if (status == RunStatus.SUCCEEDED) {
            DistributionSummary.builder("pipeline.anomaly.percentage")
                    .register(registry)
                    .record(anomalyPercentage);
            lastRunAnomalies.set(anomalies);
        }
    }

    public void recordDispatch(ChannelKind channel, boolean success) {
        Counter.builder("alert.dispatch.count")
                .tag("channel", channel.getKey())
                .tag("status", success ? "success" : "error")
                .register(registry)
                .increment();
    }
}
