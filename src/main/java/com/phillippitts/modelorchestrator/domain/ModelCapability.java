package com.phillippitts.modelorchestrator.domain;

import java.util.Locale;

/**
 * Capabilities a model worker can offer. Used both for task requirements and for model descriptors.
 *
 * <p>The {@link #id()} form is the lower-case key used in configuration and in capability scoring.
 */
public enum ModelCapability {
    CODE,
    REASONING,
    VISION,
    CONTEXT,
    ANALYSIS,
    INTERACTION,
    SPECIALIZED,
    TRANSCRIPTION,
    SYNTHESIS,
    STREAMING;

    /**
     * Returns the lower-case identifier of this capability (e.g. {@code "reasoning"}).
     *
     * @return capability id
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a capability from its id or enum name, case-insensitively.
     *
     * @param value capability id (e.g. "code" or "CODE")
     * @return matching capability
     * @throws IllegalArgumentException if the value is null or unknown
     */
    public static ModelCapability fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("capability must not be blank");
        }
        return ModelCapability.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
