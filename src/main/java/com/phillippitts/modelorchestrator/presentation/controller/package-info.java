/**
 * REST controllers. Controllers only translate HTTP to service calls; errors are mapped by
 * {@link com.phillippitts.modelorchestrator.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.modelorchestrator.presentation.controller;
