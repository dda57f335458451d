package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.domain.ResourceMap;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The bounded pool of memory, CPU and token throughput shared by all reservations.
 *
 * <p>Invariant: {@code available + sum(reservations) == total} after every operation, and
 * {@code available} never goes negative. Every credit matches exactly one earlier debit because a
 * reservation is removed in the same critical section that credits it.
 *
 * <p><b>Thread Safety:</b> every operation is atomic under one lock.
 */
final class ResourcePool {

    private final ResourceMap total;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Reservation> reservations = new LinkedHashMap<>();
    private ResourceMap available;

    ResourcePool(ResourceMap total) {
        this.total = total;
        this.available = total;
    }

    /**
     * Debits the reservation's resources if they fit what is available.
     *
     * @return true if reserved; false if it does not fit or the id is already in use
     */
    boolean tryReserve(Reservation reservation) {
        lock.lock();
        try {
            if (reservations.containsKey(reservation.id()) || !reservation.resources().fitsWithin(available)) {
                return false;
            }
            available = available.minus(reservation.resources());
            reservations.put(reservation.id(), reservation);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a reservation and credits its resources back.
     *
     * @return the released reservation, or empty if it was not live
     */
    Optional<Reservation> release(String id) {
        lock.lock();
        try {
            Reservation removed = reservations.remove(id);
            if (removed == null) {
                return Optional.empty();
            }
            credit(removed.resources());
            return Optional.of(removed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resizes a live reservation when the new amount fits once its current amount is credited back.
     *
     * @return the resized reservation, or empty if unknown or the new amount does not fit
     */
    Optional<Reservation> tryResize(String id, ResourceMap resources, Instant expiresAt) {
        lock.lock();
        try {
            Reservation current = reservations.get(id);
            if (current == null) {
                return Optional.empty();
            }
            ResourceMap withCurrentCredited = available.plus(current.resources());
            if (!resources.fitsWithin(withCurrentCredited)) {
                return Optional.empty();
            }
            Reservation resized = current.resized(resources, expiresAt);
            available = withCurrentCredited.minus(resources);
            reservations.put(id, resized);
            return Optional.of(resized);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases every reservation whose expiry is at or before {@code now}, earliest expiry first.
     *
     * @return released reservations in release order
     */
    List<Reservation> releaseExpired(Instant now) {
        lock.lock();
        try {
            List<Reservation> expired = new ArrayList<>();
            for (Reservation reservation : reservations.values()) {
                if (!reservation.expiresAt().isAfter(now)) {
                    expired.add(reservation);
                }
            }
            expired.sort(Comparator.comparing(Reservation::expiresAt));
            for (Reservation reservation : expired) {
                reservations.remove(reservation.id());
                credit(reservation.resources());
            }
            return expired;
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds the lock. An empty pool snaps back to its exact total. */
    private void credit(ResourceMap resources) {
        available = reservations.isEmpty() ? total : available.plus(resources);
    }

    Optional<Reservation> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(reservations.get(id));
        } finally {
            lock.unlock();
        }
    }

    ResourceMap available() {
        lock.lock();
        try {
            return available;
        } finally {
            lock.unlock();
        }
    }

    ResourceMap total() {
        return total;
    }

    PoolSnapshot snapshot() {
        lock.lock();
        try {
            ResourceMap allocated = ResourceMap.ZERO;
            for (Reservation reservation : reservations.values()) {
                allocated = allocated.plus(reservation.resources());
            }
            return new PoolSnapshot(total, available, allocated, reservations.size());
        } finally {
            lock.unlock();
        }
    }
}
