package com.phillippitts.modelorchestrator.service.orchestration;

/**
 * Totals across the steps of one task.
 *
 * @param totalExecutionMs sum of step backend times
 * @param totalMemoryMb    sum of the memory each step's model held
 * @param phaseCount       steps that ran, planning included
 */
public record OutcomeMetrics(long totalExecutionMs, double totalMemoryMb, int phaseCount) {
}
