package com.inventory.anomaly.service;

/**
 * The run could not be started at all, e.g. the input source is missing or unreadable.
 * Raised before any task executes; no run result exists.
 */
public class PipelineSetupException extends RuntimeException {

    public PipelineSetupException(String message) {
        super(message);
    }
}
