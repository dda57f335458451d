package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.exception.AdmissionRejectedException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the number of tasks in flight with a semaphore.
 *
 * <p>A caller waits up to the configured timeout for a permit, so brief spikes succeed while
 * sustained overload is refused.
 *
 * <pre>{@code
 * guard.acquire();
 * try {
 *     // ... run the task ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> thread-safe; the {@link Semaphore} handles concurrent acquire/release.
 */
public final class AdmissionGuard {

    private final Semaphore semaphore;
    private final int maxInFlight;
    private final long timeoutMs;

    /**
     * @param maxInFlight maximum concurrent tasks
     * @param timeoutMs maximum time to wait for a permit in milliseconds
     */
    public AdmissionGuard(int maxInFlight, long timeoutMs) {
        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be positive, got: " + maxInFlight);
        }
        this.semaphore = new Semaphore(maxInFlight, true);
        this.maxInFlight = maxInFlight;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Acquires a permit, blocking up to the configured timeout.
     *
     * @throws AdmissionRejectedException if no permit frees up in time or the thread is interrupted
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new AdmissionRejectedException(
                        "In-flight task limit (" + maxInFlight + ") reached after " + timeoutMs + "ms wait", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdmissionRejectedException("Interrupted while waiting for a task slot", timeoutMs, e);
        }
    }

    /**
     * Releases a previously acquired permit. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int inFlight() {
        return maxInFlight - semaphore.availablePermits();
    }
}
