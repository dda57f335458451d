package com.phillippitts.modelorchestrator.exception;

import com.phillippitts.modelorchestrator.domain.ResourceMap;

/**
 * Thrown when the resource pool cannot grant a reservation, either because the request does
 * not fit even after shrinking or because the current degradation level refuses its priority.
 */
public class AllocationInfeasibleException extends OrchestrationException {

    /** Why the reservation was refused. */
    public enum Reason { CAPACITY, DEGRADATION, UNKNOWN_RESERVATION }

    private final ResourceMap attempted;
    private final Reason reason;

    public AllocationInfeasibleException(String message, ResourceMap attempted, Reason reason) {
        super(message + " (reason=" + reason + ", attempted=" + attempted + ")");
        this.attempted = attempted;
        this.reason = reason;
    }

    /**
     * @return the last resource amounts that were tried, possibly already shrunk
     */
    public ResourceMap getAttempted() {
        return attempted;
    }

    public Reason getReason() {
        return reason;
    }
}
