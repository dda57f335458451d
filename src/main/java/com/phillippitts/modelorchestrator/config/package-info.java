/**
 * Spring configuration: thread pools, their metrics, and the swappable collaborators of the
 * orchestration core (clock, memory probe, model backend, model catalog).
 *
 * <p>Bound properties live in {@code config.properties}.
 */
package com.phillippitts.modelorchestrator.config;
