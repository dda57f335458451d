package com.phillippitts.modelorchestrator.service.degradation;

/**
 * Source of system memory figures sampled by the degradation monitor.
 * Implementations must be cheap and thread-safe.
 */
public interface MemoryProbe {

    /** Total physical memory in bytes. */
    long totalMemory();

    /** Free physical memory in bytes. */
    long freeMemory();

    /**
     * Used memory as a percentage of total, {@code (total - free) / total * 100}.
     * Returns 0 when total is not positive.
     */
    default double usedMemoryPercent() {
        long total = totalMemory();
        if (total <= 0) {
            return 0.0;
        }
        long free = Math.max(0L, Math.min(total, freeMemory()));
        return (double) (total - free) / total * 100.0;
    }
}
