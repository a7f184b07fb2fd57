package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when a diarization backend that reported itself available fails while processing audio.
 *
 * <p>An unavailable backend is not an error: {@code DiarizationService} checks
 * {@code isModelAvailable()} first and returns an empty result instead.
 */
public class DiarizationException extends MeetingScribeException {

    private final String backendName;

    public DiarizationException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public DiarizationException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
