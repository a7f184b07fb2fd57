package com.phillippitts.meetingscribe.domain;

import com.phillippitts.meetingscribe.service.audio.AudioFormat;

import java.util.Objects;

/**
 * An {@link AudioChunk} after the merger has replaced its source with a speaker label.
 *
 * @param samples   mono float32 samples at 16 kHz
 * @param timestamp capture time in seconds
 * @param speaker   speaker label, e.g. "You" or "Others"
 */
public record LabeledAudioChunk(float[] samples, double timestamp, String speaker) {

    public LabeledAudioChunk {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(speaker, "speaker must not be null");
    }

    public static LabeledAudioChunk from(AudioChunk chunk) {
        return new LabeledAudioChunk(chunk.samples(), chunk.timestamp(), chunk.source().speakerLabel());
    }

    public double durationSeconds() {
        return (double) samples.length / AudioFormat.REQUIRED_SAMPLE_RATE;
    }
}
