package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for capability scoring.
 *
 * <p>Properties:
 * <ul>
 *   <li>orchestrator.scoring.decay-factor - daily decay multiplier (default: 0.95)</li>
 *   <li>orchestrator.scoring.time-window - how long records count (default: 7d)</li>
 *   <li>orchestrator.scoring.min-samples - records needed before a score is reported (default: 5)</li>
 *   <li>orchestrator.scoring.weights.* - success-rate/latency/resource-usage weights (0.5/0.3/0.2)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator.scoring")
public class ScoringProperties {

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double decayFactor = 0.95;

    @NotNull
    private Duration timeWindow = Duration.ofDays(7);

    @Positive(message = "Minimum sample count must be positive")
    private int minSamples = 5;

    @Valid
    private Weights weights = new Weights();

    public double getDecayFactor() {
        return decayFactor;
    }

    public void setDecayFactor(double decayFactor) {
        this.decayFactor = decayFactor;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public void setTimeWindow(Duration timeWindow) {
        this.timeWindow = timeWindow;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    /**
     * Weights of the three score components. They are expected to sum to 1.
     */
    public static class Weights {
        @DecimalMin("0.0")
        private double successRate = 0.5;
        @DecimalMin("0.0")
        private double latency = 0.3;
        @DecimalMin("0.0")
        private double resourceUsage = 0.2;

        public double getSuccessRate() {
            return successRate;
        }

        public void setSuccessRate(double successRate) {
            this.successRate = successRate;
        }

        public double getLatency() {
            return latency;
        }

        public void setLatency(double latency) {
            this.latency = latency;
        }

        public double getResourceUsage() {
            return resourceUsage;
        }

        public void setResourceUsage(double resourceUsage) {
            this.resourceUsage = resourceUsage;
        }
    }
}
