package com.phillippitts.speaktomany.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link TranslationException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw TranslationExceptionBuilder.create("Translation request failed")
 *         .provider("llm")
 *         .cause(exception)
 *         .languagePair(Language.EN, Language.ES)
 *         .durationMs(1500)
 *         .metadata("status", 503)
 *         .build();
 * </pre>
 */
public final class TranslationExceptionBuilder {

    private final String message;
    private String provider;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranslationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static TranslationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranslationExceptionBuilder(message);
    }

    public TranslationExceptionBuilder provider(String provider) {
        this.provider = provider;
        return this;
    }

    public TranslationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranslationExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Records the source and target language as {@code source->target}.
     *
     * @param source source language (any object with a meaningful toString)
     * @param target target language
     * @return this builder for chaining
     */
    public TranslationExceptionBuilder languagePair(Object source, Object target) {
        return metadata("languages", source + "->" + target);
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TranslationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (provider: {provider})
     * </pre>
     *
     * @return constructed TranslationException
     */
    public TranslationException build() {
        String detailedMessage = buildDetailedMessage();
        String name = provider != null ? provider : "unknown";

        if (cause != null) {
            return new TranslationException(detailedMessage, name, cause);
        } else {
            return new TranslationException(detailedMessage, name);
        }
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
