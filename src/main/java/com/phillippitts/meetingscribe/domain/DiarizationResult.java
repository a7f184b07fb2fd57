package com.phillippitts.meetingscribe.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of one diarization run: who spoke when.
 *
 * <p>Immutable. Renaming a speaker yields a new result, so a caller holding an instance never sees
 * labels change underneath it.
 */
public final class DiarizationResult {

    private final List<SpeakerSegment> segments;
    private final int speakerCount;

    public DiarizationResult(List<SpeakerSegment> segments, int speakerCount) {
        Objects.requireNonNull(segments, "segments must not be null");
        if (speakerCount < 0) {
            throw new IllegalArgumentException("speakerCount must be >= 0, got: " + speakerCount);
        }
        this.segments = List.copyOf(segments);
        this.speakerCount = speakerCount;
    }

    public static DiarizationResult empty() {
        return new DiarizationResult(List.of(), 0);
    }

    /**
     * Builds a result whose speaker count is the number of distinct labels in {@code segments}.
     */
    public static DiarizationResult fromSegments(List<SpeakerSegment> segments) {
        Set<String> labels = new LinkedHashSet<>();
        for (SpeakerSegment segment : segments) {
            labels.add(segment.speakerLabel());
        }
        return new DiarizationResult(segments, labels.size());
    }

    public List<SpeakerSegment> segments() {
        return segments;
    }

    public int speakerCount() {
        return speakerCount;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * Returns the label of the first segment whose {@code [start, end)} range contains {@code time}.
     */
    public Optional<String> speakerLabelAt(double time) {
        for (SpeakerSegment segment : segments) {
            if (segment.contains(time)) {
                return Optional.of(segment.speakerLabel());
            }
        }
        return Optional.empty();
    }

    /**
     * Number of segments labeled {@code label}.
     */
    public int segmentCount(String label) {
        int count = 0;
        for (SpeakerSegment segment : segments) {
            if (segment.speakerLabel().equals(label)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a copy with every segment carrying {@code oldLabel} relabeled. Speaker count is unchanged.
     * Returns this instance when no segment carries {@code oldLabel}.
     */
    public DiarizationResult withRenamedSpeaker(String oldLabel, String newLabel) {
        Objects.requireNonNull(oldLabel, "oldLabel must not be null");
        Objects.requireNonNull(newLabel, "newLabel must not be null");
        if (segmentCount(oldLabel) == 0) {
            return this;
        }
        List<SpeakerSegment> renamed = new ArrayList<>(segments.size());
        for (SpeakerSegment segment : segments) {
            renamed.add(segment.speakerLabel().equals(oldLabel) ? segment.withLabel(newLabel) : segment);
        }
        return new DiarizationResult(renamed, speakerCount);
    }

    @Override
    public String toString() {
        return "DiarizationResult{segments=" + segments.size() + ", speakerCount=" + speakerCount + '}';
    }
}
