package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.service.sequential.StepResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a submitted task.
 *
 * @param taskId        task id
 * @param executorModel executor suggested for the task
 * @param steps         steps that ran, as {@code operation@model}
 * @param outputs       one output per step
 * @param result        outputs of the non-planning steps combined by {@link ResultSynthesizer}
 * @param phases        per-step results, planning step first when one ran
 * @param metrics       totals across {@code phases}
 * @param reservationId reservation that resourced the task (already released)
 * @param priority      priority the reservation ran at
 * @param durationMs    wall time of the pipeline, including queueing and model loads
 */
public record TaskOutcome(
        String taskId,
        String executorModel,
        List<String> steps,
        List<Object> outputs,
        Object result,
        List<StepResult> phases,
        OutcomeMetrics metrics,
        String reservationId,
        AllocationPriority priority,
        long durationMs
) {

    public TaskOutcome {
        steps = List.copyOf(steps);
        // Backends may return null for a step
        outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        phases = List.copyOf(phases);
    }

    static TaskOutcome of(String taskId, String executorModel, List<StepResult> phases, String reservationId,
                          AllocationPriority priority, long durationMs) {
        List<String> steps = phases.stream().map(StepResult::label).toList();
        List<Object> outputs = phases.stream().map(StepResult::output).toList();
        return new TaskOutcome(taskId, executorModel, steps, outputs, ResultSynthesizer.combine(phases), phases,
                ResultSynthesizer.aggregate(phases), reservationId, priority, durationMs);
    }
}
