package com.phillippitts.meetingscribe.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a speaker window could not be transcribed and its audio was dropped.
 *
 * <p>PII note: never put transcript text or audio in the context. Keep it to technical diagnostics.
 *
 * @param backend       backend name (e.g., "whisper", "cloud")
 * @param speaker       speaker label of the dropped window
 * @param generation    pipeline run the window belonged to
 * @param droppedSeconds duration of the dropped audio
 * @param at            when the failure was observed
 * @param message       short failure description
 * @param cause         underlying exception (may be null)
 * @param context       extra diagnostics
 */
public record TranscriptionFailureEvent(
        String backend,
        String speaker,
        long generation,
        double droppedSeconds,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public TranscriptionFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
