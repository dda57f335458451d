package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Capacity and timeout settings for the shared resource pool.
 *
 * <p>The pool capacity is {@code max-memory-mb} x {@code max-cpu} x {@code max-tokens-per-second}.
 * Reservation timeouts are clamped to {@code [min-timeout-ms, max-timeout-ms]}.
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator.allocator")
public class AllocatorProperties {

    @Positive
    private double maxMemoryMb = 8192;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double maxCpu = 1.0;

    @Positive
    private double maxTokensPerSecond = 1000;

    @Positive
    private long defaultTimeoutMs = 30_000;

    @Positive
    private long maxTimeoutMs = 300_000;

    @Positive
    private long minTimeoutMs = 1_000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double highUtilizationThreshold = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double criticalUtilizationThreshold = 0.9;

    /** Shrink rounds tried before a request is declared infeasible. */
    @Positive
    private int maxOptimizationAttempts = 3;

    public double getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public void setMaxMemoryMb(double maxMemoryMb) {
        this.maxMemoryMb = maxMemoryMb;
    }

    public double getMaxCpu() {
        return maxCpu;
    }

    public void setMaxCpu(double maxCpu) {
        this.maxCpu = maxCpu;
    }

    public double getMaxTokensPerSecond() {
        return maxTokensPerSecond;
    }

    public void setMaxTokensPerSecond(double maxTokensPerSecond) {
        this.maxTokensPerSecond = maxTokensPerSecond;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public long getMaxTimeoutMs() {
        return maxTimeoutMs;
    }

    public void setMaxTimeoutMs(long maxTimeoutMs) {
        this.maxTimeoutMs = maxTimeoutMs;
    }

    public long getMinTimeoutMs() {
        return minTimeoutMs;
    }

    public void setMinTimeoutMs(long minTimeoutMs) {
        this.minTimeoutMs = minTimeoutMs;
    }

    public double getHighUtilizationThreshold() {
        return highUtilizationThreshold;
    }

    public void setHighUtilizationThreshold(double highUtilizationThreshold) {
        this.highUtilizationThreshold = highUtilizationThreshold;
    }

    public double getCriticalUtilizationThreshold() {
        return criticalUtilizationThreshold;
    }

    public void setCriticalUtilizationThreshold(double criticalUtilizationThreshold) {
        this.criticalUtilizationThreshold = criticalUtilizationThreshold;
    }

    public int getMaxOptimizationAttempts() {
        return maxOptimizationAttempts;
    }

    public void setMaxOptimizationAttempts(int maxOptimizationAttempts) {
        this.maxOptimizationAttempts = maxOptimizationAttempts;
    }
}
