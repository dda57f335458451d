package com.phillippitts.modelorchestrator.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable outcome of one model invocation for a capability.
 *
 * @param success       whether the invocation succeeded
 * @param latencyMs     observed latency in milliseconds (non-negative)
 * @param resourceUsage fraction of the granted resources actually used, clamped to [0,1]
 * @param timestamp     when the outcome was recorded
 */
public record PerformanceRecord(
        boolean success,
        double latencyMs,
        double resourceUsage,
        Instant timestamp
) {

    public PerformanceRecord {
        if (latencyMs < 0 || Double.isNaN(latencyMs)) {
            throw new IllegalArgumentException("Latency must be non-negative, got: " + latencyMs);
        }
        if (Double.isNaN(resourceUsage)) {
            resourceUsage = 0.0;
        }
        resourceUsage = Math.max(0.0, Math.min(1.0, resourceUsage));
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
