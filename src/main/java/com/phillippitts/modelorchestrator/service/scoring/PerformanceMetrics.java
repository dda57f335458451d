package com.phillippitts.modelorchestrator.service.scoring;

/**
 * Averaged performance over a window of records.
 *
 * @param successRate   fraction of successful invocations
 * @param latencyMs     mean latency in milliseconds
 * @param resourceUsage mean resource usage fraction
 */
public record PerformanceMetrics(double successRate, double latencyMs, double resourceUsage) {

    public static final PerformanceMetrics EMPTY = new PerformanceMetrics(0, 0, 0);
}
