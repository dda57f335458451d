package com.phillippitts.modelorchestrator.domain;

/**
 * Caller-supplied ceilings for a task. Bounds are checked by
 * {@code TaskAnalyzer.validateRequirements}, not here, so invalid values can be represented and reported.
 *
 * @param maxMemoryMb  memory ceiling in megabytes (must be positive to be valid)
 * @param maxCpu       CPU ceiling as a fraction in (0,1]
 * @param maxLatencyMs latency ceiling in milliseconds (must be positive to be valid)
 */
public record ResourceConstraints(double maxMemoryMb, double maxCpu, double maxLatencyMs) {

    /** Constraints applied when a task does not state its own. */
    public static ResourceConstraints defaults() {
        return new ResourceConstraints(1000, 0.8, 200);
    }

    public boolean isValid() {
        return maxMemoryMb > 0
                && maxCpu > 0 && maxCpu <= 1
                && maxLatencyMs > 0;
    }
}
