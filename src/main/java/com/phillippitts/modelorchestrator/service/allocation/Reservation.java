package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.domain.ResourceMap;

import java.time.Instant;

/**
 * A live debit against the pool.
 */
record Reservation(
        String id,
        String modelId,
        ResourceMap resources,
        AllocationPriority priority,
        Instant grantedAt,
        Instant expiresAt
) {

    Reservation resized(ResourceMap newResources, Instant newExpiry) {
        return new Reservation(id, modelId, newResources, priority, grantedAt, newExpiry);
    }
}
