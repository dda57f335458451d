package com.phillippitts.modelorchestrator.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Capability and resource requirements derived for a single task.
 *
 * <p>Collections are copied and exposed unmodifiable. Null fields are preserved so
 * that malformed requirements can be reported by validation instead of failing on construction.
 *
 * @param primaryCapability     capability the executing model must have
 * @param secondaryCapabilities supporting capabilities, in lookup order
 * @param minCapabilityScores   minimum acceptable score per capability
 * @param contextSize           context window the task needs
 * @param priority              what the task optimizes for
 * @param resourceConstraints   caller ceilings
 */
public record TaskRequirements(
        ModelCapability primaryCapability,
        Set<ModelCapability> secondaryCapabilities,
        Map<ModelCapability, Double> minCapabilityScores,
        int contextSize,
        TaskPriority priority,
        ResourceConstraints resourceConstraints
) {

    public TaskRequirements {
        secondaryCapabilities = secondaryCapabilities == null
                ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(secondaryCapabilities));
        minCapabilityScores = minCapabilityScores == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(minCapabilityScores));
    }
}
