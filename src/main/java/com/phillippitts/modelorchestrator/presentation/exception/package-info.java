/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.RequirementsValidationException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.InsufficientMemoryException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.AdmissionRejectedException} → 429 Too Many Requests</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.ModelProcessingException} → 502 Bad Gateway</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.AllocationInfeasibleException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Failures of asynchronous endpoints arrive wrapped in {@code CompletionException} and are
 * mapped by their cause.
 */
package com.phillippitts.modelorchestrator.presentation.exception;
