package com.inventory.anomaly.service;

import com.inventory.anomaly.model.RunRequest;
import com.inventory.anomaly.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic ingest with the configured defaults.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.schedule", name = "enabled", havingValue = "true")
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineService pipelineService;

    public PipelineScheduler(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Scheduled(cron = "${pipeline.schedule.cron:0 0 6 * * *}")
    public void runScheduled() {
        try {
            RunResult result = pipelineService.run(new RunRequest());
            log.info("Scheduled run {} ended with status {}", result.getRunId(), result.getStatus().toJson());
        } catch (PipelineSetupException e) {
            log.error("Scheduled run not started: {}", e.getMessage());
        }
    }
}
