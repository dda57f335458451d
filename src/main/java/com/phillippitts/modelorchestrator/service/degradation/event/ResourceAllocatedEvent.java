package com.phillippitts.modelorchestrator.service.degradation.event;

import com.phillippitts.modelorchestrator.domain.AllocationPriority;

import java.time.Instant;

/**
 * Published when an allocation is admitted.
 */
public record ResourceAllocatedEvent(String id, AllocationPriority priority, double memoryUsageMb, Instant at) {
}
