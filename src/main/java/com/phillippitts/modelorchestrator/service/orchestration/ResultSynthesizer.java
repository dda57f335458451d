package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.service.sequential.StepResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Folds step results into the task's combined result and metric totals.
 *
 * <p>Combination rules for the outputs of the non-planning steps:
 * <ul>
 *   <li>a single output is returned as-is</li>
 *   <li>strings are joined with a blank line between them</li>
 *   <li>collections are concatenated in step order</li>
 *   <li>maps are merged; a later step's key wins</li>
 *   <li>anything else comes back as the list of outputs</li>
 * </ul>
 */
final class ResultSynthesizer {

    static final String SECTION_SEPARATOR = "\n\n";

    private ResultSynthesizer() {
    }

    static Object combine(List<StepResult> phases) {
        List<Object> outputs = new ArrayList<>();
        for (StepResult phase : phases) {
            if (!phase.isPlanning()) {
                outputs.add(phase.output());
            }
        }
        if (outputs.isEmpty()) {
            return null;
        }
        if (outputs.size() == 1) {
            return outputs.get(0);
        }
        if (all(outputs, String.class::isInstance)) {
            return String.join(SECTION_SEPARATOR, outputs.stream().map(String.class::cast).toList());
        }
        if (all(outputs, Collection.class::isInstance)) {
            List<Object> concatenated = new ArrayList<>();
            for (Object output : outputs) {
                concatenated.addAll((Collection<?>) output);
            }
            return concatenated;
        }
        if (all(outputs, Map.class::isInstance)) {
            Map<Object, Object> merged = new LinkedHashMap<>();
            for (Object output : outputs) {
                merged.putAll((Map<?, ?>) output);
            }
            return merged;
        }
        return outputs;
    }

    static OutcomeMetrics aggregate(List<StepResult> phases) {
        long totalMs = 0;
        double totalMemoryMb = 0;
        for (StepResult phase : phases) {
            totalMs += phase.durationMs();
            totalMemoryMb += phase.memoryMb();
        }
        return new OutcomeMetrics(totalMs, totalMemoryMb, phases.size());
    }

    private static boolean all(List<Object> outputs, Predicate<Object> test) {
        return outputs.stream().allMatch(test);
    }
}
