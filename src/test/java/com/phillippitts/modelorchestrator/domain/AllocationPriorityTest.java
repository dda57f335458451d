package com.phillippitts.modelorchestrator.domain;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationPriorityTest {

    @ParameterizedTest
    @CsvSource({
            "0.95, CRITICAL",
            "0.81, CRITICAL",
            "0.80, HIGH",
            "0.61, HIGH",
            "0.60, MEDIUM",
            "0.41, MEDIUM",
            "0.40, LOW",
            "0.0, LOW"
    })
    void derivesPriorityFromConfidence(double confidence, AllocationPriority expected) {
        assertThat(AllocationPriority.fromConfidence(confidence)).isEqualTo(expected);
    }
}
