package com.phillippitts.modelorchestrator.service.degradation.event;

import java.time.Instant;

/**
 * Published when a single allocation is released explicitly.
 */
public record ResourceReleasedEvent(String id, Instant at) {
}
