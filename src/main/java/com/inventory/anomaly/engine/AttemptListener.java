package com.inventory.anomaly.engine;

@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = attempt -> { };

    void onAttempt(TaskAttempt attempt);
}
