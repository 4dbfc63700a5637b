package com.inventory.anomaly.engine;

/**
 * Malformed or missing input. The retry engine gives up on the first occurrence
 * since re-running the same work against the same input cannot succeed.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
