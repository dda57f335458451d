package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Cap on tasks in flight through the orchestration facade.
 *
 * <p>When the cap is reached a submission waits up to {@code acquire-timeout-ms} for a slot
 * before it is rejected, so brief spikes still succeed.
 */
@ConfigurationProperties(prefix = "orchestrator.concurrency")
@Validated
public class ConcurrencyProperties {

    /** Maximum tasks processed at once. */
    @Positive(message = "Max in-flight tasks must be positive")
    private int maxInFlight = 8;

    /** How long a submission waits for a slot, in milliseconds. */
    @Positive(message = "Acquire timeout must be positive")
    private int acquireTimeoutMs = 1000;

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public void setMaxInFlight(int maxInFlight) {
        this.maxInFlight = maxInFlight;
    }

    public int getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(int acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
