package com.phillippitts.modelorchestrator.presentation.exception;

import com.phillippitts.modelorchestrator.exception.AdmissionRejectedException;
import com.phillippitts.modelorchestrator.exception.AllocationInfeasibleException;
import com.phillippitts.modelorchestrator.exception.InsufficientMemoryException;
import com.phillippitts.modelorchestrator.exception.ModelProcessingException;
import com.phillippitts.modelorchestrator.exception.RequirementsValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts orchestrator exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping internal details out of client responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed task or requirements (HTTP 400).
     */
    @ExceptionHandler(RequirementsValidationException.class)
    ResponseEntity<ApiError> handleInvalidRequirements(RequirementsValidationException ex) {
        LOG.warn("Invalid requirements: task={}", ex.getTaskId());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid task requirements", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", ex.getMessage());
    }

    /**
     * The task needs a model that does not fit the memory limit (HTTP 409).
     */
    @ExceptionHandler(InsufficientMemoryException.class)
    ResponseEntity<ApiError> handleInsufficientMemory(InsufficientMemoryException ex) {
        LOG.warn("Insufficient memory: model={}, required={}, available={}",
                ex.getModelId(), ex.getRequiredBytes(), ex.getAvailableBytes());
        return respond(HttpStatus.CONFLICT, ex.getClass().getSimpleName(),
                "Insufficient memory for the required model",
                "Choose a smaller model or retry when memory is available");
    }

    /**
     * Transient - pool exhausted or degradation refused the priority (HTTP 503).
     */
    @ExceptionHandler(AllocationInfeasibleException.class)
    ResponseEntity<ApiError> handleAllocationInfeasible(AllocationInfeasibleException ex) {
        LOG.warn("Allocation infeasible: reason={}", ex.getReason());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Resources temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Transient - too many tasks in flight (HTTP 429).
     */
    @ExceptionHandler(AdmissionRejectedException.class)
    ResponseEntity<ApiError> handleAdmissionRejected(AdmissionRejectedException ex) {
        LOG.warn("Admission rejected after {}ms", ex.getWaitedMs());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getClass().getSimpleName(),
                "Too many tasks in flight", "Please retry in a few seconds");
    }

    /**
     * Transient - the model queue is full (HTTP 503).
     */
    @ExceptionHandler(RejectedExecutionException.class)
    ResponseEntity<ApiError> handleQueueFull(RejectedExecutionException ex) {
        LOG.warn("Model queue rejected task: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "ModelQueueFull",
                "Model queue is full", "Please retry in a few seconds");
    }

    /**
     * Backend failure (HTTP 502).
     */
    @ExceptionHandler(ModelProcessingException.class)
    ResponseEntity<ApiError> handleModelProcessing(ModelProcessingException ex) {
        LOG.error("Model processing failed: model={}", ex.getModelId(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(),
                "Model backend failed", "The task was not completed");
    }

    /**
     * Async endpoints surface failures wrapped; dispatch on the cause.
     */
    @ExceptionHandler(CompletionException.class)
    ResponseEntity<ApiError> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RequirementsValidationException e) {
            return handleInvalidRequirements(e);
        }
        if (cause instanceof InsufficientMemoryException e) {
            return handleInsufficientMemory(e);
        }
        if (cause instanceof AllocationInfeasibleException e) {
            return handleAllocationInfeasible(e);
        }
        if (cause instanceof AdmissionRejectedException e) {
            return handleAdmissionRejected(e);
        }
        if (cause instanceof ModelProcessingException e) {
            return handleModelProcessing(e);
        }
        if (cause instanceof RejectedExecutionException e) {
            return handleQueueFull(e);
        }
        return handleUnexpected(ex);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
