package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.domain.DegradationLevel;
import com.phillippitts.modelorchestrator.service.allocation.PoolSnapshot;

/**
 * Point-in-time view of the orchestrator.
 *
 * @param degradationLevel   current degradation level
 * @param memoryUsagePercent last sampled system memory usage
 * @param pool               resource pool snapshot
 * @param loadedModel        id of the loaded model, or null
 * @param memoryLimitBytes   sequential orchestrator memory limit
 * @param modelMemoryBytes   memory held by the loaded model
 * @param inFlightTasks      tasks currently admitted
 */
public record OrchestrationStatus(
        DegradationLevel degradationLevel,
        double memoryUsagePercent,
        PoolSnapshot pool,
        String loadedModel,
        long memoryLimitBytes,
        long modelMemoryBytes,
        int inFlightTasks
) {
}
