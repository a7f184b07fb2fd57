package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when audio handed to a backend or the diarization service cannot be used:
 * wrong sample rate, an unreadable WAV container, or a sample count that does not fit the format.
 */
public class InvalidAudioException extends MeetingScribeException {

    private final int sampleCount;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio: " + reason);
        this.sampleCount = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int sampleCount, String reason) {
        super("Invalid audio (" + sampleCount + " samples): " + reason);
        this.sampleCount = sampleCount;
        this.reason = reason;
    }

    public InvalidAudioException(String reason, Throwable cause) {
        super("Invalid audio: " + reason, cause);
        this.sampleCount = 0;
        this.reason = reason;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public String getReason() {
        return reason;
    }
}
