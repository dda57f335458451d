package com.phillippitts.modelorchestrator.domain;

/**
 * Priority of a resource allocation, ordered from least to most important.
 *
 * <p>Degradation policy reclaims allocations strictly in this order; {@code MEDIUM} is the
 * "normal" tier assigned to routes of moderate confidence.
 */
public enum AllocationPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Derives a priority from a route confidence score.
     *
     * @param confidence confidence of the chosen route in [0,1]
     * @return CRITICAL above 0.8, HIGH above 0.6, MEDIUM above 0.4, otherwise LOW
     */
    public static AllocationPriority fromConfidence(double confidence) {
        if (confidence > 0.8) {
            return CRITICAL;
        }
        if (confidence > 0.6) {
            return HIGH;
        }
        if (confidence > 0.4) {
            return MEDIUM;
        }
        return LOW;
    }

    public boolean isBelow(AllocationPriority other) {
        return compareTo(other) < 0;
    }
}
