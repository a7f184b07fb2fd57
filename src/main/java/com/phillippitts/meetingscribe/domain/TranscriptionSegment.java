package com.phillippitts.meetingscribe.domain;

import java.util.Objects;

/**
 * A piece of text returned by a transcription backend, timed relative to the submitted buffer.
 *
 * @param text      recognized text (may be empty)
 * @param startTime seconds from the start of the buffer
 * @param endTime   seconds from the start of the buffer
 */
public record TranscriptionSegment(String text, double startTime, double endTime) {

    public TranscriptionSegment {
        Objects.requireNonNull(text, "text must not be null");
        if (endTime < startTime) {
            throw new IllegalArgumentException(
                    "endTime must not precede startTime, got start=" + startTime + " end=" + endTime);
        }
    }
}
