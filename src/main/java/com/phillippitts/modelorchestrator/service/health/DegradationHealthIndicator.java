package com.phillippitts.modelorchestrator.service.health;

import com.phillippitts.modelorchestrator.domain.DegradationLevel;
import com.phillippitts.modelorchestrator.service.allocation.PoolSnapshot;
import com.phillippitts.modelorchestrator.service.allocation.ResourceAllocator;
import com.phillippitts.modelorchestrator.service.degradation.DegradationController;
import com.phillippitts.modelorchestrator.service.sequential.SequentialOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for resource pressure.
 *
 * <ul>
 *   <li>NONE, LIGHT: UP</li>
 *   <li>MODERATE, HEAVY: UP with {@code degraded=true}</li>
 *   <li>CRITICAL: OUT_OF_SERVICE (only critical-priority work is admitted)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class DegradationHealthIndicator implements HealthIndicator {

    private final DegradationController degradation;
    private final ResourceAllocator allocator;
    private final SequentialOrchestrator sequential;

    public DegradationHealthIndicator(DegradationController degradation,
                                      ResourceAllocator allocator,
                                      SequentialOrchestrator sequential) {
        this.degradation = degradation;
        this.allocator = allocator;
        this.sequential = sequential;
    }

    @Override
    public Health health() {
        DegradationLevel level = degradation.getCurrentDegradation();
        Health.Builder builder = level == DegradationLevel.CRITICAL ? Health.outOfService() : Health.up();
        if (level == DegradationLevel.MODERATE || level == DegradationLevel.HEAVY) {
            builder.withDetail("degraded", true);
        }

        PoolSnapshot pool = allocator.snapshot();
        return builder
                .withDetail("level", level.name())
                .withDetail("memoryUsagePercent", Math.round(degradation.getLastMemoryUsagePercent() * 10) / 10.0)
                .withDetail("poolUtilization", Math.round(pool.utilization() * 100) + "%")
                .withDetail("availableMemoryMb", pool.available().memoryMb())
                .withDetail("activeReservations", pool.activeReservations())
                .withDetail("loadedModel", sequential.getLoadedModel().map(m -> m.id()).orElse("none"))
                .build();
    }
}
