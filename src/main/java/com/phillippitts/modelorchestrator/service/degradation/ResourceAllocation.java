package com.phillippitts.modelorchestrator.service.degradation;

import com.phillippitts.modelorchestrator.domain.AllocationPriority;

import java.time.Instant;

/**
 * An allocation registered with the degradation controller. Present in the controller's table
 * only while active.
 *
 * @param id            allocation id (the reservation id for pool-backed allocations)
 * @param priority      priority used by the release policy
 * @param memoryUsageMb memory the allocation holds
 * @param sequence      registration order, used to break priority ties when reclaiming
 * @param allocatedAt   registration time
 */
public record ResourceAllocation(
        String id,
        AllocationPriority priority,
        double memoryUsageMb,
        long sequence,
        Instant allocatedAt
) {
}
