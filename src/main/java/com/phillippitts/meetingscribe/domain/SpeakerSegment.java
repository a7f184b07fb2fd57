package com.phillippitts.meetingscribe.domain;

import java.util.Objects;

/**
 * A time range attributed to one speaker by diarization.
 *
 * @param speakerLabel speaker label assigned by the backend (renamable)
 * @param startTime    start in seconds, inclusive
 * @param endTime      end in seconds, exclusive
 */
public record SpeakerSegment(String speakerLabel, double startTime, double endTime) {

    public SpeakerSegment {
        Objects.requireNonNull(speakerLabel, "speakerLabel must not be null");
        if (endTime < startTime) {
            throw new IllegalArgumentException(
                    "endTime must not precede startTime, got start=" + startTime + " end=" + endTime);
        }
    }

    public boolean contains(double time) {
        return time >= startTime && time < endTime;
    }

    public double duration() {
        return endTime - startTime;
    }

    SpeakerSegment withLabel(String label) {
        return new SpeakerSegment(label, startTime, endTime);
    }
}
