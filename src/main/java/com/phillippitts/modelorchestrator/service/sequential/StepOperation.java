package com.phillippitts.modelorchestrator.service.sequential;

import com.phillippitts.modelorchestrator.domain.ModelCapability;

import java.util.Locale;

/**
 * Operation performed by one pipeline step.
 */
public enum StepOperation {
    /** Runs on the planner model ahead of the pipeline; its output is handed to the next step. */
    PLAN(ModelCapability.REASONING),
    TRANSCRIBE(ModelCapability.TRANSCRIPTION),
    SYNTHESIZE(ModelCapability.SYNTHESIS),
    ANALYZE(ModelCapability.ANALYSIS),
    /** Generic step; its capability comes from task analysis. */
    PROCESS(null);

    private final ModelCapability capability;

    StepOperation(ModelCapability capability) {
        this.capability = capability;
    }

    /**
     * Capability a model needs for this operation, or null for {@link #PROCESS}.
     */
    public ModelCapability capability() {
        return capability;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
