package com.phillippitts.modelorchestrator.exception;

/**
 * Thrown when a task's derived requirements are malformed. Always caller-correctable and never
 * retried internally.
 */
public class RequirementsValidationException extends OrchestrationException {

    private final String taskId;

    public RequirementsValidationException(String message, String taskId) {
        super(message + " (task: " + taskId + ")");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
