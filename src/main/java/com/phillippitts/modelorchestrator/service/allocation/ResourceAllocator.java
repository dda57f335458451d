package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.exception.AllocationInfeasibleException;

/**
 * Reserves slices of the bounded resource pool for routing decisions.
 */
public interface ResourceAllocator {

    /**
     * Reserves resources for a route, shrinking bottleneck dimensions when the full estimate
     * does not fit.
     *
     * @param route route to resource
     * @return the grant
     * @throws AllocationInfeasibleException if nothing fits after shrinking, or the current
     *         degradation level refuses the derived priority
     */
    AllocationResult allocateResources(RouteOptions route);

    /**
     * Reports what a reservation holds and how long it has left.
     */
    UsageMetrics monitorUsage(AllocationResult allocation);

    /**
     * Resizes a live reservation to {@code metrics.resources()} and renews its expiry.
     *
     * @throws AllocationInfeasibleException if the reservation is gone or the new size does not fit
     */
    AllocationResult adjustAllocation(UsageMetrics metrics);

    /**
     * Returns a reservation's resources to the pool.
     *
     * @return true if resources were credited; false if it was already released or expired
     */
    boolean releaseResources(AllocationResult allocation);

    /**
     * Releases every reservation past its expiry, earliest first.
     *
     * @return number of reservations released
     */
    int releaseExpired();

    PoolSnapshot snapshot();
}
