package com.phillippitts.modelorchestrator.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ModelProcessingException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ModelProcessingExceptionBuilder.create("Step failed")
 *         .model("whisper-small")
 *         .operation("transcribe")
 *         .durationMs(1200)
 *         .cause(ex)
 *         .build();
 * </pre>
 */
public final class ModelProcessingExceptionBuilder {

    private final String message;
    private String modelId;
    private String operation;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ModelProcessingExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ModelProcessingExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ModelProcessingExceptionBuilder(message);
    }

    public ModelProcessingExceptionBuilder model(String modelId) {
        this.modelId = modelId;
        return this;
    }

    /**
     * Sets the backend operation that failed (load, unload, or a step operation id).
     */
    public ModelProcessingExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    public ModelProcessingExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ModelProcessingExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata pair to the message. Null keys or values are ignored.
     */
    public ModelProcessingExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The message reads
     * {@code {message} (operation={op}, durationMs={ms}, {key}={value}, ...) (model: {id})}.
     *
     * @return constructed exception
     */
    public ModelProcessingException build() {
        String detailed = detailedMessage();
        String model = modelId != null ? modelId : "unknown";
        return new ModelProcessingException(detailed, model, operation, durationMs, cause);
    }

    private String detailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (operation != null) {
            details.put("operation", operation);
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
