package com.phillippitts.streambridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link RecognitionException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw RecognitionExceptionBuilder.create("Backend stream closed")
 *         .backend("websocket")
 *         .segment(7)
 *         .build();
 *
 * throw RecognitionExceptionBuilder.create("Connect failed")
 *         .backend("websocket")
 *         .cause(exception)
 *         .durationMs(3000)
 *         .metadata("uri", uri)
 *         .build();
 * </pre>
 */
public final class RecognitionExceptionBuilder {

    private final String message;
    private String backendName;
    private Throwable cause;
    private Long segmentId;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RecognitionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static RecognitionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RecognitionExceptionBuilder(message);
    }

    public RecognitionExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public RecognitionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the segment the failure belongs to.
     *
     * @param segmentId segment sequence number
     * @return this builder for chaining
     */
    public RecognitionExceptionBuilder segment(long segmentId) {
        this.segmentId = segmentId;
        return this;
    }

    public RecognitionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public RecognitionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (segment={id}, durationMs={ms}, {key1}={val1}, ...) (backend: {backend})
     * </pre>
     *
     * @return constructed RecognitionException
     */
    public RecognitionException build() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";

        if (cause != null) {
            return new RecognitionException(detailedMessage, backend, cause);
        } else {
            return new RecognitionException(detailedMessage, backend);
        }
    }

    private String buildDetailedMessage() {
        boolean hasDetails = segmentId != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        Details details = new Details();
        if (segmentId != null) {
            details.add("segment", segmentId);
        }
        if (durationMs != null) {
            details.add("durationMs", durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            details.add(entry.getKey(), entry.getValue());
        }
        return message + " (" + details + ")";
    }

    private static final class Details {
        private final StringBuilder sb = new StringBuilder();

        void add(String key, Object value) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(key).append('=').append(value);
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}
