package com.dagflow.core.exception;

/**
 * Base type for structural problems reported synchronously to the caller before any
 * task runs: bad identifiers and dependency cycles.
 */
public class WorkflowConfigurationException extends RuntimeException {

    public WorkflowConfigurationException(String message) {
        super(message);
    }
}
