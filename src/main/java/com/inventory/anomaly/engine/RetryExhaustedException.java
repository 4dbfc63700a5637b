package com.inventory.anomaly.engine;

/**
 * Every permitted attempt of a unit of work failed. The cause is the last error seen.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Gave up after " + attempts + (attempts == 1 ? " attempt" : " attempts")
                + (lastError != null ? ": " + lastError.getMessage() : ""), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
