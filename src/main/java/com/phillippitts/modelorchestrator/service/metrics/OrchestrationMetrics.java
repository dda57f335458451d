package com.phillippitts.modelorchestrator.service.metrics;

import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.service.allocation.ResourceAllocator;
import com.phillippitts.modelorchestrator.service.degradation.DegradationController;
import com.phillippitts.modelorchestrator.service.degradation.event.DegradationChangedEvent;
import com.phillippitts.modelorchestrator.service.degradation.event.ResourcesReleasedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the orchestration core.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Task latency and success/failure counts per executor model</li>
 *   <li>Allocation outcomes per priority</li>
 *   <li>Degradation transitions and reclaimed allocations (from controller events)</li>
 *   <li>Gauges for pool availability and the current degradation level</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class OrchestrationMetrics {

    private static final String METRIC_PREFIX = "orchestrator";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry,
                                ResourceAllocator allocator,
                                DegradationController degradation) {
        this.registry = registry;

        Gauge.builder(METRIC_PREFIX + ".pool.available.memory", allocator, a -> a.snapshot().available().memoryMb())
                .description("Unreserved pool memory in MB")
                .baseUnit("megabytes")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".pool.available.cpu", allocator, a -> a.snapshot().available().cpu())
                .description("Unreserved pool CPU fraction")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".pool.available.tokens", allocator, a -> a.snapshot().available().tokensPerSecond())
                .description("Unreserved pool token throughput")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".pool.reservations", allocator, a -> a.snapshot().activeReservations())
                .description("Live reservations")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".degradation.level", degradation, d -> d.getCurrentDegradation().ordinal())
                .description("Current degradation level (0=NONE .. 4=CRITICAL)")
                .register(registry);
    }

    /**
     * Records end-to-end task latency.
     *
     * @param model executor model id
     * @param durationNanos duration in nanoseconds
     */
    public void recordTaskLatency(String model, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".task.latency")
                .description("Time taken to run a task pipeline")
                .tag("model", model)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTaskSuccess(String model) {
        Counter.builder(METRIC_PREFIX + ".task.success")
                .description("Number of successful tasks")
                .tag("model", model)
                .register(registry)
                .increment();
    }

    /**
     * @param model executor model id, or "none" when the task failed before routing
     * @param reason failure reason (exception simple name)
     */
    public void incrementTaskFailure(String model, String reason) {
        Counter.builder(METRIC_PREFIX + ".task.failure")
                .description("Number of failed tasks")
                .tag("model", model)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "granted", "capacity" or "degradation"
     * @param priority priority of the request
     */
    public void recordAllocation(String outcome, AllocationPriority priority) {
        Counter.builder(METRIC_PREFIX + ".allocation")
                .description("Allocation attempts by outcome")
                .tag("outcome", outcome)
                .tag("priority", priority.name())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onDegradationChanged(DegradationChangedEvent event) {
        Counter.builder(METRIC_PREFIX + ".degradation.transitions")
                .description("Degradation level transitions by target level")
                .tag("level", event.level().name())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onResourcesReleased(ResourcesReleasedEvent event) {
        Counter.builder(METRIC_PREFIX + ".reclaimed")
                .description("Allocations reclaimed by the degradation policy or shutdown")
                .register(registry)
                .increment(event.count());
    }
}
