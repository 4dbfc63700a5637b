package com.inventory.anomaly.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable per-run state of one task. Owned by {@link TaskGraphExecutor}; callers only read it.
 */
public class TaskExecution {

    private final Task<?> task;
    private final List<TaskAttempt> attempts = new ArrayList<>();
    private TaskState state = TaskState.PENDING;
    private String detail;

    TaskExecution(Task<?> task) {
        this.task = task;
    }

    void start() {
        requireState(TaskState.PENDING);
        state = TaskState.RUNNING;
    }

    void recordAttempt(TaskAttempt attempt) {
        requireState(TaskState.RUNNING);
        if (attempt.getAttemptNumber() != attempts.size() + 1) {
            throw new IllegalStateException("Task " + task.getId() + ": attempt " + attempt.getAttemptNumber()
                    + " recorded out of order after " + attempts.size() + " attempts");
        }
        attempts.add(attempt);
    }

    void succeed() {
        requireState(TaskState.RUNNING);
        if (attempts.isEmpty() || !attempts.get(attempts.size() - 1).isSuccess()) {
            throw new IllegalStateException("Task " + task.getId() + " cannot succeed without a successful attempt");
        }
        state = TaskState.SUCCEEDED;
    }

    void fail(String reason) {
        requireState(TaskState.RUNNING);
        state = TaskState.FAILED;
        detail = reason;
    }

    void skip(String reason) {
        requireState(TaskState.PENDING);
        state = TaskState.SKIPPED;
        detail = reason;
    }

    private void requireState(TaskState expected) {
        if (state != expected) {
            throw new IllegalStateException("Task " + task.getId() + " is " + state + ", expected " + expected);
        }
    }

    public String getTaskId() {
        return task.getId();
    }

    public boolean isRequired() {
        return task.isRequired();
    }

    public TaskState getState() {
        return state;
    }

    public List<TaskAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    /** Failure or skip reason; null for succeeded tasks. */
    public String getDetail() {
        return detail;
    }
}
