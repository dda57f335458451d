package com.phillippitts.modelorchestrator.service.sequential;

import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.domain.ModelType;

import java.util.Objects;

/**
 * One step of a task pipeline.
 *
 * @param modelType  model chosen to run the step
 * @param operation  what the step does
 * @param capability capability the step needs
 */
public record ProcessingStep(ModelType modelType, StepOperation operation, ModelCapability capability) {

    public ProcessingStep {
        Objects.requireNonNull(modelType, "modelType");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(capability, "capability");
    }
}
