package com.phillippitts.meetingscribe.exception;

/**
 * Base exception for all meetingscribe errors.
 * Pipeline, backend and diarization failures extend this class so callers can catch them in one place.
 */
public class MeetingScribeException extends RuntimeException {

    public MeetingScribeException(String message) {
        super(message);
    }

    public MeetingScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public MeetingScribeException(Throwable cause) {
        super(cause);
    }
}
