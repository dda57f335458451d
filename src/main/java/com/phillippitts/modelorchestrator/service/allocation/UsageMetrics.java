package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.domain.ResourceMap;

/**
 * Usage observed for a reservation. Also the input to {@code adjustAllocation}, where
 * {@code resources} is the amount the reservation should be resized to.
 *
 * @param reservationId reservation the figures belong to
 * @param resources     resources held (or wanted, when adjusting)
 * @param elapsedMs     time since the reservation was granted
 * @param remainingMs   time left before expiry, 0 when expired
 * @param active        whether the reservation still holds pool resources
 */
public record UsageMetrics(
        String reservationId,
        ResourceMap resources,
        long elapsedMs,
        long remainingMs,
        boolean active
) {
}
