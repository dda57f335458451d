package com.phillippitts.modelorchestrator.domain;

/**
 * Amount of each pooled resource. Used both for pool capacity and for a single reservation.
 *
 * @param memoryMb        memory in megabytes
 * @param cpu             CPU as a fraction of the machine
 * @param tokensPerSecond token throughput
 */
public record ResourceMap(double memoryMb, double cpu, double tokensPerSecond) {

    public static final ResourceMap ZERO = new ResourceMap(0, 0, 0);

    public ResourceMap {
        if (memoryMb < 0 || cpu < 0 || tokensPerSecond < 0) {
            throw new IllegalArgumentException(
                    "Resource amounts must be non-negative: memoryMb=" + memoryMb
                            + ", cpu=" + cpu + ", tokensPerSecond=" + tokensPerSecond);
        }
    }

    /**
     * Returns true when every component of this map is less than or equal to the matching
     * component of {@code capacity}.
     */
    public boolean fitsWithin(ResourceMap capacity) {
        return memoryMb <= capacity.memoryMb
                && cpu <= capacity.cpu
                && tokensPerSecond <= capacity.tokensPerSecond;
    }

    public ResourceMap plus(ResourceMap other) {
        return new ResourceMap(memoryMb + other.memoryMb, cpu + other.cpu, tokensPerSecond + other.tokensPerSecond);
    }

    /**
     * Componentwise subtraction. Fails rather than producing a negative amount.
     *
     * @throws IllegalArgumentException if any component would go negative
     */
    public ResourceMap minus(ResourceMap other) {
        return new ResourceMap(memoryMb - other.memoryMb, cpu - other.cpu, tokensPerSecond - other.tokensPerSecond);
    }

    public ResourceMap withMemoryMb(double value) {
        return new ResourceMap(value, cpu, tokensPerSecond);
    }

    public ResourceMap withCpu(double value) {
        return new ResourceMap(memoryMb, value, tokensPerSecond);
    }

    public ResourceMap withTokensPerSecond(double value) {
        return new ResourceMap(memoryMb, cpu, value);
    }
}
