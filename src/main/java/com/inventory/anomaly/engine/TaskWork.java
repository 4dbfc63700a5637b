package com.inventory.anomaly.engine;

/**
 * Unit of work of a task. Reads predecessor outputs from the context and
 * returns this task's output, or throws to signal a failed attempt.
 */
@FunctionalInterface
public interface TaskWork<T> {

    T execute(TaskContext context) throws Exception;
}
