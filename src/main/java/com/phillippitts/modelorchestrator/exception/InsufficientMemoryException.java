package com.phillippitts.modelorchestrator.exception;

/**
 * Thrown when a model cannot be admitted because its memory requirement exceeds what the
 * orchestrator may hold. The caller can recover by picking a smaller model or unloading first.
 */
public class InsufficientMemoryException extends OrchestrationException {

    private final String modelId;
    private final long requiredBytes;
    private final long availableBytes;

    public InsufficientMemoryException(String modelId, long requiredBytes, long availableBytes) {
        super("Insufficient memory to load model " + modelId
                + ": required=" + requiredBytes + " bytes, available=" + availableBytes + " bytes");
        this.modelId = modelId;
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public String getModelId() {
        return modelId;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}
