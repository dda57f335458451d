package com.phillippitts.modelorchestrator.service.degradation.event;

import java.time.Instant;
import java.util.List;

/**
 * Published when allocations are reclaimed in bulk, by the release policy or on shutdown.
 */
public record ResourcesReleasedEvent(int count, List<String> resourceIds, Instant at) {

    public ResourcesReleasedEvent {
        resourceIds = List.copyOf(resourceIds);
    }
}
