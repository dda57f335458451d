package com.phillippitts.modelorchestrator.service.analysis;

import com.phillippitts.modelorchestrator.domain.ModelType;

import java.util.Objects;

/**
 * Planner/executor pair suggested for a task.
 *
 * @param planner  model that plans (has REASONING)
 * @param executor model that runs the primary capability
 */
public record ModelChain(ModelType planner, ModelType executor) {

    public ModelChain {
        Objects.requireNonNull(planner, "planner");
        Objects.requireNonNull(executor, "executor");
    }
}
