package com.phillippitts.modelorchestrator.service.allocation;

import com.phillippitts.modelorchestrator.domain.ResourceMap;

/**
 * Soft ceilings handed to the caller with a grant. They carry a buffer over the granted amounts
 * and are advisory; the pool does not enforce them.
 */
public record AllocationConstraints(double maxMemoryMb, double maxCpu, double maxTokensPerSecond) {

    /**
     * Adds 20% to memory and CPU (CPU capped at 1) and 10% to tokens, rounding memory and tokens up.
     */
    public static AllocationConstraints bufferedFrom(ResourceMap granted) {
        return new AllocationConstraints(
                Math.ceil(granted.memoryMb() * 12 / 10),
                Math.min(1.0, granted.cpu() * 1.2),
                Math.ceil(granted.tokensPerSecond() * 11 / 10));
    }
}
