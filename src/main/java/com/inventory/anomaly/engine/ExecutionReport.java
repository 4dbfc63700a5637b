package com.inventory.anomaly.engine;

import com.inventory.anomaly.model.RunResult;
import lombok.Value;

import java.util.Map;

/**
 * What the executor hands back after a run: the sealed result plus the per-task audit trail.
 */
@Value
public class ExecutionReport {
    RunResult result;
    Map<String, TaskExecution> executions;

    public TaskExecution execution(String taskId) {
        return executions.get(taskId);
    }
}
