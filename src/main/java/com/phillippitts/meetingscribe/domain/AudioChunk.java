package com.phillippitts.meetingscribe.domain;

import java.util.Objects;

/**
 * A block of mono float PCM samples at 16 kHz delivered by a capture collaborator.
 *
 * <p>The sample array is not copied. Producers must not mutate it after emitting the chunk.
 *
 * @param samples   mono float32 samples in [-1, 1]
 * @param timestamp capture time in seconds, non-decreasing within one source
 * @param source    stream the chunk came from
 */
public record AudioChunk(float[] samples, double timestamp, AudioSource source) {

    public AudioChunk {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (Double.isNaN(timestamp) || timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be a non-negative number, got: " + timestamp);
        }
    }
}
