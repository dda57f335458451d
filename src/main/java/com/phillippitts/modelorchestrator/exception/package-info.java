/**
 * Orchestrator exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.OrchestrationException} - Base exception
 *       for all orchestrator errors</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.InsufficientMemoryException} - A model
 *       does not fit within the orchestrator's memory limit</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.AllocationInfeasibleException} - The
 *       resource pool cannot grant a reservation, even after shrinking</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.RequirementsValidationException} - Task
 *       requirements are malformed</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.ModelProcessingException} - A model
 *       backend failed</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.AdmissionRejectedException} - Too many
 *       tasks in flight</li>
 * </ul>
 *
 * <p>Resource exhaustion is deliberately not an exception: it shows up as the CRITICAL degradation
 * level and as allocation rejections.
 *
 * <p>All exceptions are unchecked, support chaining, and map to HTTP status codes in
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.modelorchestrator.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.modelorchestrator.exception;
