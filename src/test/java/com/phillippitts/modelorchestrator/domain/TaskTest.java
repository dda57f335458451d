package com.phillippitts.modelorchestrator.domain;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    @Test
    void taskRequiresIdAndType() {
        assertThatThrownBy(() -> Task.of(null, "analysis", "x")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Task.of("t-1", null, "x")).isInstanceOf(NullPointerException.class);
    }

    @Test
    void taskOfLeavesOptionalFieldsUnset() {
        Task task = Task.of("t-1", "analysis", null);

        assertThat(task.priority()).isNull();
        assertThat(task.resourceConstraints()).isNull();
    }

    @Test
    void requirementsCopyCollections() {
        Set<ModelCapability> secondaries = new LinkedHashSet<>(Set.of(ModelCapability.ANALYSIS));
        Map<ModelCapability, Double> scores = new HashMap<>(Map.of(ModelCapability.CODE, 0.8));

        TaskRequirements requirements = new TaskRequirements(ModelCapability.CODE, secondaries, scores, 2048,
                TaskPriority.QUALITY, ResourceConstraints.defaults());
        secondaries.add(ModelCapability.REASONING);
        scores.put(ModelCapability.REASONING, 0.6);

        assertThat(requirements.secondaryCapabilities()).containsExactly(ModelCapability.ANALYSIS);
        assertThat(requirements.minCapabilityScores()).containsOnlyKeys(ModelCapability.CODE);
    }

    @Test
    void resourceConstraintsValidity() {
        assertThat(ResourceConstraints.defaults().isValid()).isTrue();
        assertThat(new ResourceConstraints(0, 0.5, 100).isValid()).isFalse();
        assertThat(new ResourceConstraints(100, 1.5, 100).isValid()).isFalse();
        assertThat(new ResourceConstraints(100, 0.5, 0).isValid()).isFalse();
    }

    @Test
    void modelTypeReportsCapabilitiesAndMegabytes() {
        ModelType model = new ModelType("m", null, 2L * 1024 * 1024 * 1024,
                EnumSet.of(ModelCapability.TRANSCRIPTION));

        assertThat(model.name()).isEqualTo("m");
        assertThat(model.hasCapability(ModelCapability.TRANSCRIPTION)).isTrue();
        assertThat(model.hasCapability(ModelCapability.CODE)).isFalse();
        assertThat(model.memoryRequirementMb()).isEqualTo(2048.0);
    }

    @Test
    void capabilityIdsRoundTrip() {
        assertThat(ModelCapability.fromId("Reasoning")).isEqualTo(ModelCapability.REASONING);
        assertThat(ModelCapability.CODE.id()).isEqualTo("code");
        assertThatThrownBy(() -> ModelCapability.fromId(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void performanceRecordClampsUsageAndRejectsNegativeLatency() {
        PerformanceRecord record = new PerformanceRecord(true, 10, 1.7, java.time.Instant.EPOCH);

        assertThat(record.resourceUsage()).isEqualTo(1.0);
        assertThatThrownBy(() -> new PerformanceRecord(true, -1, 0.5, java.time.Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
