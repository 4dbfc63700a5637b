package com.inventory.anomaly.engine;

import lombok.Value;

import java.time.Duration;

/**
 * Bounded retry with a fixed delay between attempts.
 * {@code maxAttempts} counts the initial attempt, so 3 means one try plus two retries.
 */
@Value
public class RetryPolicy {
    int maxAttempts;
    Duration delay;

    public static RetryPolicy of(int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be a non-negative duration");
        }
        return new RetryPolicy(maxAttempts, delay);
    }

    public static RetryPolicy once() {
        return new RetryPolicy(1, Duration.ZERO);
    }
}
