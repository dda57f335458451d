package com.phillippitts.modelorchestrator.service.scoring;

import com.phillippitts.modelorchestrator.domain.ModelCapability;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-model view of capability scores.
 *
 * @param modelId            model the scores belong to
 * @param capabilities       score per capability that has enough samples
 * @param performanceMetrics metrics averaged over those capabilities
 */
public record CapabilityScore(
        String modelId,
        Map<ModelCapability, Double> capabilities,
        PerformanceMetrics performanceMetrics
) {

    public CapabilityScore {
        capabilities = capabilities.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(capabilities));
    }
}
