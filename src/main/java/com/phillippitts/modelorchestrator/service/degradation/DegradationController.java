package com.phillippitts.modelorchestrator.service.degradation;

import com.phillippitts.modelorchestrator.config.properties.DegradationProperties;
import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.domain.DegradationLevel;
import com.phillippitts.modelorchestrator.service.degradation.event.DegradationChangedEvent;
import com.phillippitts.modelorchestrator.service.degradation.event.ResourceAllocatedEvent;
import com.phillippitts.modelorchestrator.service.degradation.event.ResourceReleasedEvent;
import com.phillippitts.modelorchestrator.service.degradation.event.ResourcesReleasedEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Five-level degradation state machine driven by a recurring memory sample.
 *
 * <p>State model:
 * <ul>
 *   <li>Each tick samples the {@link MemoryProbe} and maps used memory to a {@link DegradationLevel}.</li>
 *   <li>On a level change the release policy reclaims every active allocation whose priority the
 *       new level names, lowest priority first and oldest first within a priority. The reclaim is
 *       published before the level change.</li>
 *   <li>Admission is gated by the current level: HEAVY refuses anything below HIGH, CRITICAL
 *       refuses anything below CRITICAL.</li>
 *   <li>After the level check each registered {@link ResourcePressureListener} gets a tick, so the
 *       one timer also owns reservation expiry.</li>
 * </ul>
 *
 * <p>Reclamation is policy, not an error: it is only observable through events and later
 * admission refusals.
 *
 * <p><b>Thread Safety:</b> all state is mutated under a single lock. Events are published and
 * listeners are called after the lock is released.
 */
@Component
public class DegradationController {

    private static final Logger LOG = LogManager.getLogger(DegradationController.class);

    private final DegradationProperties props;
    private final MemoryProbe memoryProbe;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final TaskScheduler scheduler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ResourceAllocation> active = new LinkedHashMap<>();
    private final List<ResourcePressureListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private DegradationLevel level = DegradationLevel.NONE;
    private double lastMemoryUsagePercent;
    private ScheduledFuture<?> monitorTask;

    public DegradationController(DegradationProperties props,
                                 MemoryProbe memoryProbe,
                                 ApplicationEventPublisher publisher,
                                 Clock clock,
                                 @Qualifier("monitorScheduler") TaskScheduler scheduler) {
        this.props = Objects.requireNonNull(props, "props");
        this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler;
    }

    /**
     * Starts the monitor timer when monitoring is enabled and a scheduler is available.
     */
    @PostConstruct
    public void start() {
        if (!props.isEnabled() || scheduler == null) {
            LOG.info("Degradation monitor not started (enabled={}, scheduler={})",
                    props.isEnabled(), scheduler != null);
            return;
        }
        lock.lock();
        try {
            if (monitorTask != null || shutdown.get()) {
                return;
            }
            monitorTask = scheduler.scheduleAtFixedRate(this::safeTick,
                    Duration.ofMillis(props.getMonitoringIntervalMs()));
        } finally {
            lock.unlock();
        }
        LOG.info("Degradation monitor started: interval={}ms, memoryThreshold={}%, criticalThreshold={}%",
                props.getMonitoringIntervalMs(), props.getMemoryThreshold(), props.getCriticalThreshold());
    }

    public void addPressureListener(ResourcePressureListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Runs one monitor cycle: sample memory, update the level, apply the release policy on a
     * transition, then give every listener its maintenance tick.
     *
     * @return the level after this tick
     */
    public DegradationLevel tick() {
        if (shutdown.get()) {
            return getCurrentDegradation();
        }
        Instant now = clock.instant();
        double usedPercent = memoryProbe.usedMemoryPercent();
        DegradationLevel next = DegradationLevel.forUsage(
                usedPercent, props.getMemoryThreshold(), props.getCriticalThreshold());

        DegradationLevel previous;
        List<ResourceAllocation> reclaimed = List.of();
        lock.lock();
        try {
            previous = level;
            lastMemoryUsagePercent = usedPercent;
            if (next != previous) {
                level = next;
                reclaimed = removeReclaimable(next.reclaimedPriorities());
            }
        } finally {
            lock.unlock();
        }

        if (next != previous) {
            logTransition(previous, next, usedPercent);
            notifyReclaimed(reclaimed, now);
            publisher.publishEvent(new DegradationChangedEvent(next, previous, usedPercent, now));
        }
        for (ResourcePressureListener listener : listeners) {
            listener.onMonitorTick(now);
        }
        return next;
    }

    /**
     * Registers an allocation if the current level admits its priority.
     *
     * @param id allocation id
     * @param priority allocation priority
     * @param memoryUsageMb memory the allocation holds
     * @return true if admitted, false if refused by the current level or after shutdown
     */
    public boolean allocateResource(String id, AllocationPriority priority, double memoryUsageMb) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(priority, "priority");
        Instant now = clock.instant();
        DegradationLevel current;
        boolean admitted;
        lock.lock();
        try {
            current = level;
            admitted = !shutdown.get() && current.admits(priority);
            if (admitted) {
                active.put(id, new ResourceAllocation(id, priority, memoryUsageMb, sequence.incrementAndGet(), now));
            }
        } finally {
            lock.unlock();
        }

        if (!admitted) {
            LOG.warn("Refused allocation {}: priority={} not admitted at level={}{}",
                    id, priority, current, shutdown.get() ? " (shut down)" : "");
            return false;
        }
        LOG.debug("Admitted allocation {} (priority={}, memoryMb={})", id, priority, memoryUsageMb);
        publisher.publishEvent(new ResourceAllocatedEvent(id, priority, memoryUsageMb, now));
        return true;
    }

    /**
     * Releases a single allocation.
     *
     * @param id allocation id
     * @return true if the allocation was active
     */
    public boolean releaseResource(String id) {
        ResourceAllocation removed;
        lock.lock();
        try {
            removed = active.remove(id);
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        LOG.debug("Released allocation {} (priority={})", id, removed.priority());
        publisher.publishEvent(new ResourceReleasedEvent(id, clock.instant()));
        return true;
    }

    /**
     * Records a new memory figure for an active allocation, keeping its priority and its place in
     * the reclaim order.
     *
     * @param id allocation id
     * @param memoryUsageMb memory the allocation now holds
     * @return true if the allocation was active
     */
    public boolean updateResource(String id, double memoryUsageMb) {
        Objects.requireNonNull(id, "id");
        ResourceAllocation previous;
        lock.lock();
        try {
            previous = active.get(id);
            if (previous != null) {
                active.put(id, new ResourceAllocation(id, previous.priority(), memoryUsageMb,
                        previous.sequence(), previous.allocatedAt()));
            }
        } finally {
            lock.unlock();
        }
        if (previous == null) {
            LOG.debug("Update of {} ignored: not active", id);
            return false;
        }
        LOG.debug("Updated allocation {}: memoryMb {} -> {}", id, previous.memoryUsageMb(), memoryUsageMb);
        return true;
    }

    public DegradationLevel getCurrentDegradation() {
        lock.lock();
        try {
            return level;
        } finally {
            lock.unlock();
        }
    }

    public double getLastMemoryUsagePercent() {
        lock.lock();
        try {
            return lastMemoryUsagePercent;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of active allocations in registration order.
     */
    public List<ResourceAllocation> getActiveResources() {
        lock.lock();
        try {
            return List.copyOf(active.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the timer and force-releases every allocation regardless of priority.
     * Safe to call more than once; later calls do nothing.
     */
    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<ResourceAllocation> released;
        lock.lock();
        try {
            if (monitorTask != null) {
                monitorTask.cancel(false);
                monitorTask = null;
            }
            released = new ArrayList<>(active.values());
            released.sort(reclaimOrder());
            active.clear();
        } finally {
            lock.unlock();
        }
        LOG.info("Degradation monitor stopped; force-released {} allocation(s)", released.size());
        notifyReclaimed(released, clock.instant());
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException ex) {
            // Keep the fixed-rate schedule alive; a thrown exception would cancel it
            LOG.error("Degradation monitor tick failed", ex);
        }
    }

    /** Caller holds the lock. */
    private List<ResourceAllocation> removeReclaimable(Set<AllocationPriority> priorities) {
        if (priorities.isEmpty()) {
            return List.of();
        }
        List<ResourceAllocation> victims = new ArrayList<>();
        for (ResourceAllocation allocation : active.values()) {
            if (priorities.contains(allocation.priority())) {
                victims.add(allocation);
            }
        }
        victims.sort(reclaimOrder());
        for (ResourceAllocation victim : victims) {
            active.remove(victim.id());
        }
        return victims;
    }

    private void notifyReclaimed(List<ResourceAllocation> reclaimed, Instant now) {
        if (reclaimed.isEmpty()) {
            return;
        }
        List<String> ids = reclaimed.stream().map(ResourceAllocation::id).toList();
        LOG.warn("Reclaimed {} allocation(s): {}", ids.size(), ids);
        publisher.publishEvent(new ResourcesReleasedEvent(ids.size(), ids, now));
        for (ResourcePressureListener listener : listeners) {
            listener.onAllocationsReclaimed(reclaimed);
        }
    }

    private static Comparator<ResourceAllocation> reclaimOrder() {
        return Comparator.comparing(ResourceAllocation::priority)
                .thenComparingLong(ResourceAllocation::sequence);
    }

    private static void logTransition(DegradationLevel previous, DegradationLevel next, double usedPercent) {
        if (next.compareTo(previous) > 0) {
            LOG.warn("Degradation level raised {} -> {} (memory used {}%)",
                    previous, next, String.format("%.1f", usedPercent));
        } else {
            LOG.info("Degradation level lowered {} -> {} (memory used {}%)",
                    previous, next, String.format("%.1f", usedPercent));
        }
    }
}
