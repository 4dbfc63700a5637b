package com.inventory.anomaly.engine;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> {
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    };

    void sleep(Duration delay) throws InterruptedException;
}
