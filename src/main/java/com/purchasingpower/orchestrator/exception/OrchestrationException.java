package com.purchasingpower.orchestrator.exception;

/**
 * Base type for every failure raised inside the orchestration core.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
