package com.phillippitts.modelorchestrator.service.scoring;

import com.phillippitts.modelorchestrator.config.properties.ScoringProperties;
import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.domain.PerformanceRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks per-model, per-capability outcomes and turns them into a decayed score in [0,1].
 *
 * <p>Scoring rules:
 * <ul>
 *   <li>Records older than the time window are pruned before every computation.</li>
 *   <li>Fewer than {@code minSamples} surviving records yield 0.</li>
 *   <li>Otherwise the newest {@code minSamples} records are averaged into success rate, latency
 *       and resource usage; latency is penalized as {@code 1-(l/500)^1.5} and resource usage as
 *       {@code 1-u^2}.</li>
 *   <li>Mean latency above 800ms or mean usage above 0.8 halves the score.</li>
 *   <li>The result decays by {@code decayFactor^days} since the newest record.</li>
 * </ul>
 *
 * <p>Scores never throw; unknown models or capabilities score 0.
 *
 * <p><b>Thread Safety:</b> history is held per (model, capability) pair in a concurrent map and
 * each pair is mutated under its own monitor.
 */
@Component
public class CapabilityScorer {

    private static final Logger LOG = LogManager.getLogger(CapabilityScorer.class);

    private static final double LATENCY_REFERENCE_MS = 500.0;
    private static final double LATENCY_EXPONENT = 1.5;
    private static final double SEVERE_LATENCY_MS = 800.0;
    private static final double SEVERE_RESOURCE_USAGE = 0.8;
    private static final double SEVERE_PENALTY = 0.5;
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ScoringProperties props;
    private final Clock clock;
    private final ConcurrentMap<String, ConcurrentMap<ModelCapability, ModelCapabilityData>> modelData =
            new ConcurrentHashMap<>();

    public CapabilityScorer(ScoringProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void recordSuccess(String modelId, ModelCapability capability, double latencyMs, double resourceUsage) {
        record(modelId, capability, true, latencyMs, resourceUsage);
    }

    public void recordFailure(String modelId, ModelCapability capability, double latencyMs, double resourceUsage) {
        record(modelId, capability, false, latencyMs, resourceUsage);
    }

    /**
     * Returns the current score for a model's capability.
     *
     * @return score in [0,1]; 0 when there is not enough recent evidence
     */
    public double getCapabilityScore(String modelId, ModelCapability capability) {
        ModelCapabilityData data = find(modelId, capability);
        if (data == null) {
            return 0.0;
        }
        synchronized (data) {
            return refresh(data);
        }
    }

    /**
     * Returns scores for every capability of a model that has at least {@code minSamples} records,
     * with performance metrics averaged across those capabilities.
     */
    public CapabilityScore getModelScores(String modelId) {
        Map<ModelCapability, Double> scores = new EnumMap<>(ModelCapability.class);
        ConcurrentMap<ModelCapability, ModelCapabilityData> capabilities = modelData.get(modelId);
        if (capabilities == null) {
            return new CapabilityScore(modelId, scores, PerformanceMetrics.EMPTY);
        }

        double successRate = 0;
        double latency = 0;
        double resourceUsage = 0;
        int counted = 0;
        for (Map.Entry<ModelCapability, ModelCapabilityData> entry : capabilities.entrySet()) {
            ModelCapabilityData data = entry.getValue();
            synchronized (data) {
                double score = refresh(data);
                if (data.size() < props.getMinSamples()) {
                    continue;
                }
                scores.put(entry.getKey(), score);
                PerformanceMetrics metrics = metricsOf(data.mostRecent(props.getMinSamples()));
                successRate += metrics.successRate();
                latency += metrics.latencyMs();
                resourceUsage += metrics.resourceUsage();
                counted++;
            }
        }

        PerformanceMetrics averaged = counted == 0
                ? PerformanceMetrics.EMPTY
                : new PerformanceMetrics(successRate / counted, latency / counted, resourceUsage / counted);
        return new CapabilityScore(modelId, scores, averaged);
    }

    /**
     * Orders candidate model ids by descending score for a capability. Ties keep input order.
     */
    public List<String> rankModels(ModelCapability capability, Collection<String> candidates) {
        List<String> ranked = new ArrayList<>(candidates);
        Map<String, Double> scores = new HashMap<>();
        for (String id : ranked) {
            scores.put(id, getCapabilityScore(id, capability));
        }
        ranked.sort(Comparator.comparingDouble((String id) -> scores.get(id)).reversed());
        return ranked;
    }

    private void record(String modelId, ModelCapability capability, boolean success,
                        double latencyMs, double resourceUsage) {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(capability, "capability");
        PerformanceRecord record = new PerformanceRecord(success, latencyMs, resourceUsage, clock.instant());

        ModelCapabilityData data = modelData
                .computeIfAbsent(modelId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(capability, k -> new ModelCapabilityData());
        synchronized (data) {
            data.append(record);
            double score = refresh(data);
            LOG.debug("Recorded {} for model={}, capability={}, latencyMs={}, samples={}, score={}",
                    success ? "success" : "failure", modelId, capability.id(), latencyMs, data.size(), score);
        }
    }

    private ModelCapabilityData find(String modelId, ModelCapability capability) {
        if (modelId == null || capability == null) {
            return null;
        }
        Map<ModelCapability, ModelCapabilityData> capabilities = modelData.get(modelId);
        return capabilities == null ? null : capabilities.get(capability);
    }

    /** Prunes, recomputes and decays the aggregate. Caller holds the data's monitor. */
    private double refresh(ModelCapabilityData data) {
        Instant now = clock.instant();
        data.pruneBefore(now.minus(props.getTimeWindow()));

        int minSamples = props.getMinSamples();
        if (data.size() < minSamples) {
            data.aggregateScore(0.0);
            return 0.0;
        }

        double raw = aggregate(metricsOf(data.mostRecent(minSamples)));
        double days = Math.max(0, Duration.between(data.lastUpdated(), now).toMillis()) / MILLIS_PER_DAY;
        double score = clamp(raw * Math.pow(props.getDecayFactor(), days));
        data.aggregateScore(score);
        return score;
    }

    private double aggregate(PerformanceMetrics metrics) {
        ScoringProperties.Weights weights = props.getWeights();
        double latencyScore = Math.max(0, 1 - Math.pow(metrics.latencyMs() / LATENCY_REFERENCE_MS, LATENCY_EXPONENT));
        double resourceScore = Math.max(0, 1 - Math.pow(metrics.resourceUsage(), 2));

        double score = metrics.successRate() * weights.getSuccessRate()
                + latencyScore * weights.getLatency()
                + resourceScore * weights.getResourceUsage();

        if (metrics.latencyMs() > SEVERE_LATENCY_MS || metrics.resourceUsage() > SEVERE_RESOURCE_USAGE) {
            score *= SEVERE_PENALTY;
        }
        return score;
    }

    private static PerformanceMetrics metricsOf(List<PerformanceRecord> recent) {
        if (recent.isEmpty()) {
            return PerformanceMetrics.EMPTY;
        }
        int successes = 0;
        double latency = 0;
        double usage = 0;
        for (PerformanceRecord r : recent) {
            if (r.success()) {
                successes++;
            }
            latency += r.latencyMs();
            usage += r.resourceUsage();
        }
        int n = recent.size();
        return new PerformanceMetrics((double) successes / n, latency / n, usage / n);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
