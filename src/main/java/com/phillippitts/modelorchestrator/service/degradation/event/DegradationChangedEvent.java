package com.phillippitts.modelorchestrator.service.degradation.event;

import com.phillippitts.modelorchestrator.domain.DegradationLevel;

import java.time.Instant;

/**
 * Published when the degradation level changes.
 */
public record DegradationChangedEvent(
        DegradationLevel level,
        DegradationLevel previous,
        double memoryUsagePercent,
        Instant at
) {
}
