package com.phillippitts.modelorchestrator.service.sequential;

/**
 * Input handed to the first step after a planning step.
 *
 * @param input the step's own input
 * @param plan  output of the planning step
 */
public record PlannedInput(Object input, Object plan) {
}
