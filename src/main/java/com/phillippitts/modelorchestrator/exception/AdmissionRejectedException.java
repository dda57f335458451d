package com.phillippitts.modelorchestrator.exception;

/**
 * Thrown when a task cannot enter the orchestrator because the in-flight limit stays reached
 * for the whole admission wait. Transient; the caller may retry.
 */
public class AdmissionRejectedException extends OrchestrationException {

    private final long waitedMs;

    public AdmissionRejectedException(String message, long waitedMs) {
        super(message);
        this.waitedMs = waitedMs;
    }

    public AdmissionRejectedException(String message, long waitedMs, Throwable cause) {
        super(message, cause);
        this.waitedMs = waitedMs;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
