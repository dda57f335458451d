package com.phillippitts.modelorchestrator.service.analysis;

import com.phillippitts.modelorchestrator.domain.Task;
import com.phillippitts.modelorchestrator.domain.TaskRequirements;
import com.phillippitts.modelorchestrator.exception.RequirementsValidationException;

/**
 * Maps incoming tasks to capability and resource requirements.
 */
public interface TaskAnalyzer {

    /**
     * Derives requirements for a task from its type and input.
     *
     * @param task task to analyze (must not be null)
     * @return validated requirements
     * @throws RequirementsValidationException if the derived requirements are invalid,
     *         for example because the caller supplied out-of-range constraints
     */
    TaskRequirements analyze(Task task);

    /**
     * Checks that every field is populated and within bounds. Never throws.
     *
     * @param requirements requirements to check (may be null)
     * @return true if valid
     */
    boolean validateRequirements(TaskRequirements requirements);

    /**
     * Suggests a planner and an executor for already-analyzed requirements.
     *
     * @param requirements analyzed requirements
     * @return model chain; never null
     */
    ModelChain suggestModelChain(TaskRequirements requirements);
}
