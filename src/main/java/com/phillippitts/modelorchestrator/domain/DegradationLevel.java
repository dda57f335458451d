package com.phillippitts.modelorchestrator.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Discrete system-pressure tiers, ordered {@code NONE < LIGHT < MODERATE < HEAVY < CRITICAL}.
 *
 * <p>Each level knows which allocation priorities it reclaims on entry and the lowest priority
 * it still admits.
 */
public enum DegradationLevel {
    NONE(EnumSet.noneOf(AllocationPriority.class), AllocationPriority.LOW),
    LIGHT(EnumSet.of(AllocationPriority.LOW), AllocationPriority.LOW),
    MODERATE(EnumSet.of(AllocationPriority.LOW, AllocationPriority.MEDIUM), AllocationPriority.LOW),
    HEAVY(EnumSet.of(AllocationPriority.LOW, AllocationPriority.MEDIUM), AllocationPriority.HIGH),
    CRITICAL(EnumSet.of(AllocationPriority.LOW, AllocationPriority.MEDIUM, AllocationPriority.HIGH),
            AllocationPriority.CRITICAL);

    private final EnumSet<AllocationPriority> reclaimed;
    private final AllocationPriority minimumAdmitted;

    DegradationLevel(EnumSet<AllocationPriority> reclaimed, AllocationPriority minimumAdmitted) {
        this.reclaimed = reclaimed;
        this.minimumAdmitted = minimumAdmitted;
    }

    /**
     * Maps a used-memory percentage to a level.
     *
     * @param usedMemoryPercent used memory in percent of total
     * @param memoryThreshold percentage at which LIGHT starts; MODERATE and HEAVY start 10 and 15 points higher
     * @param criticalThreshold percentage at which CRITICAL starts
     * @return the matching level
     */
    public static DegradationLevel forUsage(double usedMemoryPercent, double memoryThreshold, double criticalThreshold) {
        if (usedMemoryPercent >= criticalThreshold) {
            return CRITICAL;
        }
        if (usedMemoryPercent >= memoryThreshold + 15) {
            return HEAVY;
        }
        if (usedMemoryPercent >= memoryThreshold + 10) {
            return MODERATE;
        }
        if (usedMemoryPercent >= memoryThreshold) {
            return LIGHT;
        }
        return NONE;
    }

    /** Priorities released when the system enters this level. */
    public Set<AllocationPriority> reclaimedPriorities() {
        return EnumSet.copyOf(reclaimed);
    }

    public boolean admits(AllocationPriority priority) {
        return !priority.isBelow(minimumAdmitted);
    }
}
