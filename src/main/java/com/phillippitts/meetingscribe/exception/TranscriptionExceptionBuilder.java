package com.phillippitts.meetingscribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Collects failure context for a {@link TranscriptionException}.
 *
 * <p>Details are appended to the message in the order they were added:
 * <pre>
 * Non-zero exit: 1 (exitCode=1, durationMs=820, modelPath=models/ggml-base.bin, stderr=...)
 * </pre>
 * Null detail values are skipped so callers can pass optional context unconditionally.
 */
public final class TranscriptionExceptionBuilder {

    private static final String UNKNOWN_BACKEND = "unknown";

    private final String message;
    private final Map<String, String> details = new LinkedHashMap<>();
    private String backendName = UNKNOWN_BACKEND;
    private Throwable cause;

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder backend(String backendName) {
        if (backendName != null) {
            this.backendName = backendName;
        }
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        return metadata("exitCode", exitCode);
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        return metadata("durationMs", durationMs);
    }

    /**
     * Adds one {@code key=value} detail. Re-adding a key replaces its value in place.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            details.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String fullMessage = details.isEmpty() ? message : message + " " + renderDetails();
        return cause == null
                ? new TranscriptionException(fullMessage, backendName)
                : new TranscriptionException(fullMessage, backendName, cause);
    }

    private String renderDetails() {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        details.forEach((key, value) -> joiner.add(key + "=" + value));
        return joiner.toString();
    }
}
