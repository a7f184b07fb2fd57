package com.phillippitts.meetingscribe.service.pipeline;

import com.phillippitts.meetingscribe.domain.LabeledAudioChunk;

import java.util.Arrays;

/**
 * Append-only sample accumulator for one speaker.
 *
 * <p>Not thread-safe. Owned by {@link SpeakerWindowDispatcher} and only touched under its lock.
 */
final class SpeakerBuffer {

    private static final int INITIAL_CAPACITY = 16_000;

    private final int sampleRate;
    private float[] samples = new float[INITIAL_CAPACITY];
    private int size;
    private double startTime;
    private double lastChunkTime;

    SpeakerBuffer(int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        this.sampleRate = sampleRate;
    }

    /**
     * Appends a chunk. The first chunk after a clear sets the window start time.
     */
    void append(LabeledAudioChunk chunk) {
        float[] incoming = chunk.samples();
        if (size == 0) {
            startTime = chunk.timestamp();
        }
        ensureCapacity(size + incoming.length);
        System.arraycopy(incoming, 0, samples, size, incoming.length);
        size += incoming.length;
        lastChunkTime = chunk.timestamp();
    }

    /**
     * Drops the oldest samples so that at most {@code targetSamples} remain. The start time moves forward
     * by the dropped duration so it stays aligned with the first kept sample.
     *
     * @return number of samples dropped
     */
    int trimTo(int targetSamples) {
        int excess = size - Math.max(0, targetSamples);
        if (excess <= 0) {
            return 0;
        }
        System.arraycopy(samples, excess, samples, 0, size - excess);
        size -= excess;
        startTime += (double) excess / sampleRate;
        return excess;
    }

    float[] snapshot() {
        return Arrays.copyOf(samples, size);
    }

    void clear() {
        size = 0;
        startTime = 0;
        lastChunkTime = 0;
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    double durationSeconds() {
        return (double) size / sampleRate;
    }

    double startTime() {
        return startTime;
    }

    double lastChunkTime() {
        return lastChunkTime;
    }

    private void ensureCapacity(int required) {
        if (required > samples.length) {
            samples = Arrays.copyOf(samples, Math.max(required, samples.length * 2));
        }
    }
}
