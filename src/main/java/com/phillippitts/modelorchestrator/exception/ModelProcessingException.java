package com.phillippitts.modelorchestrator.exception;

/**
 * Thrown when a model backend fails to load, unload or process a step.
 * Surfaced to the caller as-is; nothing in the orchestrator retries it.
 */
public class ModelProcessingException extends OrchestrationException {

    private final String modelId;
    private final String operation;
    private final Long durationMs;

    public ModelProcessingException(String message) {
        super(message);
        this.modelId = "unknown";
        this.operation = null;
        this.durationMs = null;
    }

    public ModelProcessingException(String message, String modelId) {
        this(message, modelId, null, null, null);
    }

    public ModelProcessingException(String message, Throwable cause) {
        super(message, cause);
        this.modelId = "unknown";
        this.operation = null;
        this.durationMs = null;
    }

    public ModelProcessingException(String message, String modelId, Throwable cause) {
        this(message, modelId, null, null, cause);
    }

    /**
     * @param operation  backend operation that failed, or null
     * @param durationMs time spent in the failed call, or null if not measured
     * @param cause      backend failure, or null
     */
    public ModelProcessingException(String message, String modelId, String operation, Long durationMs,
                                    Throwable cause) {
        super(message + " (model: " + modelId + ")", cause);
        this.modelId = modelId;
        this.operation = operation;
        this.durationMs = durationMs;
    }

    public String getModelId() {
        return modelId;
    }

    /** Failed operation ({@code load}, {@code unload} or a step operation id), or null. */
    public String getOperation() {
        return operation;
    }

    /** Milliseconds spent in the failed call, or null when it was not timed. */
    public Long getDurationMs() {
        return durationMs;
    }
}
