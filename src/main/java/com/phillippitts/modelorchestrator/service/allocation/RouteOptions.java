package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.domain.ResourceMap;

import java.util.Objects;

/**
 * A routing decision to be resourced.
 *
 * @param executorModelId model that will execute the task
 * @param estimatedCost   resources the route is expected to need
 * @param confidence      confidence in the executor for this task, in [0,1]
 */
public record RouteOptions(String executorModelId, ResourceMap estimatedCost, double confidence) {

    public RouteOptions {
        Objects.requireNonNull(executorModelId, "executorModelId");
        Objects.requireNonNull(estimatedCost, "estimatedCost");
    }
}
