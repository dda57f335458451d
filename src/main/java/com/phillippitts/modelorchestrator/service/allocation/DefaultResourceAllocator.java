package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.config.properties.AllocatorProperties;
import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.domain.ResourceMap;
import com.phillippitts.modelorchestrator.exception.AllocationInfeasibleException;
import com.phillippitts.modelorchestrator.service.degradation.DegradationController;
import com.phillippitts.modelorchestrator.service.degradation.ResourceAllocation;
import com.phillippitts.modelorchestrator.service.degradation.ResourcePressureListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Pool-backed allocator.
 *
 * <p>Allocation flow:
 * <ol>
 *   <li>Start from the route's estimated cost.</li>
 *   <li>Reserve it if it fits; otherwise shrink each bottleneck dimension (memory x0.8, CPU x0.8,
 *       tokens x0.9) and retry, up to {@code max-optimization-attempts} rounds.</li>
 *   <li>Register the reservation with the {@link DegradationController}; if the current level
 *       refuses its priority, roll the debit back.</li>
 * </ol>
 *
 * <p>The allocator listens to the controller: reclaimed allocations are credited back and each
 * monitor tick runs the expiry sweep.
 */
@Service
public class DefaultResourceAllocator implements ResourceAllocator, ResourcePressureListener {

    private static final Logger LOG = LogManager.getLogger(DefaultResourceAllocator.class);

    static final double MEMORY_SHRINK = 0.8;
    static final double CPU_SHRINK = 0.8;
    static final double TOKEN_SHRINK = 0.9;

    private final AllocatorProperties props;
    private final DegradationController degradation;
    private final Clock clock;
    private final ResourcePool pool;

    public DefaultResourceAllocator(AllocatorProperties props, DegradationController degradation, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.degradation = Objects.requireNonNull(degradation, "degradation");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pool = new ResourcePool(new ResourceMap(
                props.getMaxMemoryMb(), props.getMaxCpu(), props.getMaxTokensPerSecond()));
        degradation.addPressureListener(this);
    }

    @Override
    public AllocationResult allocateResources(RouteOptions route) {
        Objects.requireNonNull(route, "route");
        AllocationPriority priority = AllocationPriority.fromConfidence(route.confidence());
        long timeoutMs = calculateTimeout(route.estimatedCost());
        Instant now = clock.instant();
        Instant expiresAt = now.plusMillis(timeoutMs);
        String reservationId = route.executorModelId() + "-" + UUID.randomUUID();

        ResourceMap candidate = route.estimatedCost();
        Reservation reservation = null;
        for (int attempt = 0; attempt <= props.getMaxOptimizationAttempts(); attempt++) {
            if (attempt > 0) {
                candidate = shrinkBottlenecks(candidate, pool.available());
            }
            Reservation attemptReservation = new Reservation(
                    reservationId, route.executorModelId(), candidate, priority, now, expiresAt);
            if (pool.tryReserve(attemptReservation)) {
                reservation = attemptReservation;
                if (attempt > 0) {
                    LOG.info("Allocation for {} shrunk to fit after {} attempt(s): requested={}, granted={}",
                            route.executorModelId(), attempt, route.estimatedCost(), candidate);
                }
                break;
            }
        }
        if (reservation == null) {
            LOG.warn("Allocation infeasible for {}: requested={}, last attempt={}, available={}",
                    route.executorModelId(), route.estimatedCost(), candidate, pool.available());
            throw new AllocationInfeasibleException("Resources unavailable for route " + route.executorModelId(),
                    candidate, AllocationInfeasibleException.Reason.CAPACITY);
        }

        if (!degradation.allocateResource(reservationId, priority, candidate.memoryMb())) {
            pool.release(reservationId);
            throw new AllocationInfeasibleException(
                    "Allocation refused at degradation level " + degradation.getCurrentDegradation(),
                    candidate, AllocationInfeasibleException.Reason.DEGRADATION);
        }

        LOG.debug("Reserved {} for {}: {} (priority={}, timeoutMs={})",
                reservationId, route.executorModelId(), candidate, priority, timeoutMs);
        checkUtilization();
        return new AllocationResult(reservationId, candidate,
                AllocationConstraints.bufferedFrom(candidate), priority, timeoutMs, expiresAt);
    }

    @Override
    public UsageMetrics monitorUsage(AllocationResult allocation) {
        Instant now = clock.instant();
        Optional<Reservation> live = pool.find(allocation.reservationId());
        if (live.isEmpty()) {
            long elapsed = Duration.between(allocation.expiresAt().minusMillis(allocation.timeoutMs()), now).toMillis();
            return new UsageMetrics(allocation.reservationId(), allocation.allocated(), Math.max(0, elapsed), 0, false);
        }
        Reservation reservation = live.get();
        long elapsed = Math.max(0, Duration.between(reservation.grantedAt(), now).toMillis());
        long remaining = Math.max(0, Duration.between(now, reservation.expiresAt()).toMillis());
        return new UsageMetrics(reservation.id(), reservation.resources(), elapsed, remaining, true);
    }

    @Override
    public AllocationResult adjustAllocation(UsageMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics");
        Reservation current = pool.find(metrics.reservationId()).orElseThrow(() ->
                new AllocationInfeasibleException("Reservation " + metrics.reservationId() + " is no longer live",
                        metrics.resources(), AllocationInfeasibleException.Reason.UNKNOWN_RESERVATION));

        long timeoutMs = calculateTimeout(metrics.resources());
        Instant expiresAt = clock.instant().plusMillis(timeoutMs);
        Reservation resized = pool.tryResize(current.id(), metrics.resources(), expiresAt).orElseThrow(() ->
                new AllocationInfeasibleException("Cannot resize reservation " + current.id(),
                        metrics.resources(), AllocationInfeasibleException.Reason.CAPACITY));

        degradation.updateResource(resized.id(), resized.resources().memoryMb());
        LOG.debug("Resized {}: {} -> {} (timeoutMs={})", current.id(), current.resources(), resized.resources(), timeoutMs);
        checkUtilization();
        return new AllocationResult(resized.id(), resized.resources(),
                AllocationConstraints.bufferedFrom(resized.resources()), resized.priority(), timeoutMs, expiresAt);
    }

    @Override
    public boolean releaseResources(AllocationResult allocation) {
        Optional<Reservation> released = pool.release(allocation.reservationId());
        if (released.isEmpty()) {
            LOG.debug("Release of {} ignored: not live", allocation.reservationId());
            return false;
        }
        degradation.releaseResource(allocation.reservationId());
        LOG.debug("Released {}: {}", allocation.reservationId(), released.get().resources());
        return true;
    }

    @Override
    public int releaseExpired() {
        return releaseExpired(clock.instant());
    }

    @Override
    public PoolSnapshot snapshot() {
        return pool.snapshot();
    }

    @Override
    public void onAllocationsReclaimed(List<ResourceAllocation> reclaimed) {
        int credited = 0;
        for (ResourceAllocation allocation : reclaimed) {
            if (pool.release(allocation.id()).isPresent()) {
                credited++;
            }
        }
        if (credited > 0) {
            LOG.warn("Credited {} reclaimed reservation(s) back to the pool", credited);
        }
    }

    @Override
    public void onMonitorTick(Instant now) {
        releaseExpired(now);
    }

    private int releaseExpired(Instant now) {
        List<Reservation> expired = pool.releaseExpired(now);
        for (Reservation reservation : expired) {
            degradation.releaseResource(reservation.id());
            LOG.info("Reservation {} for {} expired at {}", reservation.id(), reservation.modelId(), reservation.expiresAt());
        }
        return expired.size();
    }

    /**
     * {@code clamp(default x (1 + (mem/maxMem + cpu/maxCpu + tokens/maxTokens) / 3), min, max)}.
     */
    long calculateTimeout(ResourceMap cost) {
        double load = (cost.memoryMb() / props.getMaxMemoryMb()
                + cost.cpu() / props.getMaxCpu()
                + cost.tokensPerSecond() / props.getMaxTokensPerSecond()) / 3.0;
        double timeout = props.getDefaultTimeoutMs() * (1 + load);
        double clamped = Math.min(Math.max(timeout, props.getMinTimeoutMs()), props.getMaxTimeoutMs());
        return Math.round(clamped);
    }

    /** Shrinks each dimension that exceeds what is available; leaves the others alone. */
    static ResourceMap shrinkBottlenecks(ResourceMap needs, ResourceMap available) {
        ResourceMap shrunk = needs;
        if (needs.memoryMb() > available.memoryMb()) {
            shrunk = shrunk.withMemoryMb(needs.memoryMb() * MEMORY_SHRINK);
        }
        if (needs.cpu() > available.cpu()) {
            shrunk = shrunk.withCpu(needs.cpu() * CPU_SHRINK);
        }
        if (needs.tokensPerSecond() > available.tokensPerSecond()) {
            shrunk = shrunk.withTokensPerSecond(needs.tokensPerSecond() * TOKEN_SHRINK);
        }
        return shrunk;
    }

    private void checkUtilization() {
        PoolSnapshot snapshot = pool.snapshot();
        double utilization = snapshot.utilization();
        if (utilization > props.getCriticalUtilizationThreshold()) {
            LOG.error("Resource pool utilization critical: {}% (available={})",
                    Math.round(utilization * 100), snapshot.available());
        } else if (utilization > props.getHighUtilizationThreshold()) {
            LOG.warn("Resource pool utilization high: {}% (available={})",
                    Math.round(utilization * 100), snapshot.available());
        }
    }
}
