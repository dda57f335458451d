package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.domain.ResourceMap;

/**
 * Point-in-time view of the resource pool.
 *
 * @param total              pool capacity
 * @param available          unreserved resources
 * @param allocated          sum of live reservations
 * @param activeReservations number of live reservations
 */
public record PoolSnapshot(ResourceMap total, ResourceMap available, ResourceMap allocated, int activeReservations) {

    /**
     * Highest per-dimension utilisation, in [0,1].
     */
    public double utilization() {
        return Math.max(ratio(allocated.memoryMb(), total.memoryMb()),
                Math.max(ratio(allocated.cpu(), total.cpu()),
                        ratio(allocated.tokensPerSecond(), total.tokensPerSecond())));
    }

    private static double ratio(double used, double capacity) {
        return capacity <= 0 ? 0.0 : used / capacity;
    }
}
