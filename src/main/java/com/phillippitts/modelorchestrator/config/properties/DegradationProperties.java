package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the degradation monitor.
 *
 * <p>Thresholds are percentages of used system memory. When {@code enabled=false} the monitor
 * timer is not started; the level can still be driven by calling the controller's tick directly.
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator.degradation")
public class DegradationProperties {

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double memoryThreshold;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double criticalThreshold;

    @Positive
    private final long monitoringIntervalMs;

    private final boolean enabled;

    @ConstructorBinding
    public DegradationProperties(Double memoryThreshold,
                                 Double criticalThreshold,
                                 Long monitoringIntervalMs,
                                 Boolean enabled) {
        this.memoryThreshold = memoryThreshold == null ? 70.0 : memoryThreshold;
        this.criticalThreshold = criticalThreshold == null ? 90.0 : criticalThreshold;
        this.monitoringIntervalMs = monitoringIntervalMs == null ? 1000L : monitoringIntervalMs;
        this.enabled = enabled == null || enabled;
    }

    /**
     * Defaults, for tests and programmatic construction.
     */
    public DegradationProperties() {
        this(null, null, null, null);
    }

    public double getMemoryThreshold() {
        return memoryThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public long getMonitoringIntervalMs() {
        return monitoringIntervalMs;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
