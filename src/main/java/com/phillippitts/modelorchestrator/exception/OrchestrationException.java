package com.phillippitts.modelorchestrator.exception;

/**
 * Base exception for all model orchestrator errors.
 * All domain exceptions extend this class so the REST boundary can handle them in one place.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public OrchestrationException(Throwable cause) {
        super(cause);
    }
}
