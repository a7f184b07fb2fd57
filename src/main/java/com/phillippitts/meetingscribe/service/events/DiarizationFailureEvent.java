package com.phillippitts.meetingscribe.service.events;

import java.time.Instant;

/**
 * Published when an available diarization backend fails on a buffer.
 */
public record DiarizationFailureEvent(String backend, Instant at, String message, Throwable cause) {
    public DiarizationFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
