package com.inventory.anomaly.engine;

import lombok.Value;

/**
 * One execution attempt of a task. Attempts are appended to the owning
 * {@link TaskExecution} and never modified afterwards.
 */
@Value
public class TaskAttempt {
    int attemptNumber;
    boolean success;
    String error;

    public static TaskAttempt succeeded(int attemptNumber) {
        return new TaskAttempt(attemptNumber, true, null);
    }

    public static TaskAttempt failed(int attemptNumber, Throwable error) {
        String detail = error.getMessage() != null
                ? error.getClass().getSimpleName() + ": " + error.getMessage()
                : error.getClass().getSimpleName();
        return new TaskAttempt(attemptNumber, false, detail);
    }
}
