package com.inventory.anomaly.engine;

import java.util.HashMap;
import java.util.Map;

/**
 * Outputs of the tasks that have succeeded so far in the current run.
 */
public class TaskContext {

    private final Map<String, Object> outputs = new HashMap<>();

    void put(String taskId, Object output) {
        outputs.put(taskId, output);
    }

    public boolean has(String taskId) {
        return outputs.containsKey(taskId);
    }

    public <T> T output(String taskId, Class<T> type) {
        if (!outputs.containsKey(taskId)) {
            throw new IllegalStateException("No output recorded for task '" + taskId + "'");
        }
        return type.cast(outputs.get(taskId));
    }
}
