package com.phillippitts.modelorchestrator.service.degradation;

import java.time.Instant;
import java.util.List;

/**
 * Collaborator driven by the degradation monitor.
 *
 * <p>Callbacks run on the monitor thread (or the caller of {@code shutdown()}), never while the
 * controller holds its lock, so implementations may take their own locks.
 */
public interface ResourcePressureListener {

    /**
     * Allocations the release policy (or shutdown) has just taken away.
     *
     * @param reclaimed reclaimed allocations, lowest priority first
     */
    void onAllocationsReclaimed(List<ResourceAllocation> reclaimed);

    /**
     * Called once per monitor tick after the level check, for periodic maintenance
     * such as expiring stale reservations.
     *
     * @param now tick time
     */
    default void onMonitorTick(Instant now) {
    }
}
