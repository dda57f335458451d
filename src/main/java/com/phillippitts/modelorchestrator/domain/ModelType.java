package com.phillippitts.modelorchestrator.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable descriptor of a loadable model worker.
 *
 * @param id                     unique model id
 * @param name                   display name
 * @param memoryRequirementBytes memory needed while the model is loaded
 * @param capabilities           capabilities the model offers
 */
public record ModelType(
        String id,
        String name,
        long memoryRequirementBytes,
        Set<ModelCapability> capabilities
) {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    public ModelType {
        Objects.requireNonNull(id, "Model id must not be null");
        name = name == null ? id : name;
        if (memoryRequirementBytes < 0) {
            throw new IllegalArgumentException("Memory requirement must be non-negative, got: " + memoryRequirementBytes);
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    public boolean hasCapability(ModelCapability capability) {
        return capabilities.contains(capability);
    }

    /** Memory requirement expressed in megabytes, the unit of the resource pool. */
    public double memoryRequirementMb() {
        return (double) memoryRequirementBytes / BYTES_PER_MB;
    }
}
