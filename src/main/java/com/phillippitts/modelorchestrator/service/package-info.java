/**
 * Orchestration core.
 *
 * <ul>
 *   <li>{@code scoring} - per-model capability scores from recorded outcomes</li>
 *   <li>{@code analysis} - task requirements and planner/executor suggestions</li>
 *   <li>{@code allocation} - the resource pool and reservations</li>
 *   <li>{@code degradation} - memory-pressure levels and reclamation</li>
 *   <li>{@code sequential} - single-active-model pipeline execution</li>
 *   <li>{@code orchestration} - the facade that ties them together</li>
 * </ul>
 */
package com.phillippitts.modelorchestrator.service;
