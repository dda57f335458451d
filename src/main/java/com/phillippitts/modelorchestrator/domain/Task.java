package com.phillippitts.modelorchestrator.domain;

import java.util.Objects;

/**
 * A unit of work submitted for orchestration.
 *
 * @param id                  caller-assigned identifier, used for logging correlation
 * @param type                task type (e.g. "code_generation", "transcription")
 * @param input               opaque input handed to the model backend; may be null
 * @param priority            requested priority, or null for the default
 * @param resourceConstraints requested ceilings, or null for the defaults
 */
public record Task(
        String id,
        String type,
        Object input,
        TaskPriority priority,
        ResourceConstraints resourceConstraints
) {

    public Task {
        Objects.requireNonNull(id, "Task id must not be null");
        Objects.requireNonNull(type, "Task type must not be null");
    }

    public static Task of(String id, String type, Object input) {
        return new Task(id, type, input, null, null);
    }
}
