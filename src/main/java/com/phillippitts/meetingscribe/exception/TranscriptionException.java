package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when a transcription backend fails to turn a speaker window into text.
 * Causes include a crashed or timed-out process, an HTTP error, or unparseable output.
 */
public class TranscriptionException extends MeetingScribeException {

    private final String backendName;

    public TranscriptionException(String message) {
        super(message);
        this.backendName = "unknown";
    }

    public TranscriptionException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.backendName = "unknown";
    }

    public TranscriptionException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
