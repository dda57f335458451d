package com.phillippitts.modelorchestrator.service.sequential;

import com.phillippitts.modelorchestrator.domain.ModelCapability;

import java.util.Objects;

/**
 * What one pipeline step produced.
 *
 * @param operation  step operation id
 * @param modelId    model that ran the step
 * @param capability capability the step exercised
 * @param output     backend output; may be null
 * @param durationMs time spent in the backend call, excluding queueing and model loads
 * @param memoryMb   memory the model holds while loaded
 */
public record StepResult(
        String operation,
        String modelId,
        ModelCapability capability,
        Object output,
        long durationMs,
        double memoryMb
) {

    public StepResult {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(capability, "capability");
    }

    public boolean isPlanning() {
        return StepOperation.PLAN.id().equals(operation);
    }

    /** {@code operation@model}. */
    public String label() {
        return operation + "@" + modelId;
    }
}
