package com.phillippitts.meetingscribe.domain;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable, speaker-attributed text emitted by the pipeline.
 *
 * <p>Times are absolute: the start time of the speaker window plus the backend's relative offsets.
 *
 * @param id               unique segment id
 * @param text             transcribed text
 * @param startTime        absolute start in seconds
 * @param endTime          absolute end in seconds
 * @param speaker          speaker label
 * @param detectedLanguage language detected from the text, if any
 */
public record TranscriptSegment(
        UUID id,
        String text,
        double startTime,
        double endTime,
        String speaker,
        Optional<AppLanguage> detectedLanguage
) {

    public TranscriptSegment {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(detectedLanguage, "detectedLanguage must not be null (use Optional.empty())");
        if (endTime < startTime) {
            throw new IllegalArgumentException(
                    "endTime must not precede startTime, got start=" + startTime + " end=" + endTime);
        }
    }

    /**
     * Converts a backend-relative segment into an absolute one for the given window.
     */
    public static TranscriptSegment of(TranscriptionSegment relative, double bufferStartTime, String speaker,
                                       Optional<AppLanguage> detectedLanguage) {
        return new TranscriptSegment(
                UUID.randomUUID(),
                relative.text(),
                bufferStartTime + relative.startTime(),
                bufferStartTime + relative.endTime(),
                speaker,
                detectedLanguage);
    }
}
