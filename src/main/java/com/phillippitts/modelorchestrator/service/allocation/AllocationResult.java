package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.domain.ResourceMap;

import java.time.Instant;

/**
 * A granted reservation. Its resources return to the pool on release or expiry, whichever
 * comes first.
 *
 * @param reservationId id used to monitor, adjust or release the reservation
 * @param allocated     resources debited from the pool
 * @param constraints   buffered soft ceilings
 * @param priority      priority derived from route confidence
 * @param timeoutMs     reservation lifetime
 * @param expiresAt     when the expiry sweep reclaims it
 */
public record AllocationResult(
        String reservationId,
        ResourceMap allocated,
        AllocationConstraints constraints,
        AllocationPriority priority,
        long timeoutMs,
        Instant expiresAt
) {
}
