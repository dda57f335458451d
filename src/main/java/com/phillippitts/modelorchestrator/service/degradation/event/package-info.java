/**
 * Typed events emitted by the degradation controller.
 *
 * <p>Events are for observers (metrics, logging, UIs); nothing in the orchestration core
 * listens to them to make decisions.
 */
package com.phillippitts.modelorchestrator.service.degradation.event;
