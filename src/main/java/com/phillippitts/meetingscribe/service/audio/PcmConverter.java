package com.phillippitts.meetingscribe.service.audio;

import java.util.Objects;

import static com.phillippitts.meetingscribe.service.audio.AudioFormat.PCM16_SCALE;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;

/**
 * Conversions between float32 samples and 16-bit little-endian PCM, plus signal energy.
 */
public final class PcmConverter {

    private PcmConverter() {}

    /**
     * Encodes float samples as PCM16LE. Each sample is clamped to [-1, 1], scaled by 32767
     * and truncated toward zero.
     */
    public static byte[] toPcm16Le(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        byte[] out = new byte[samples.length * REQUIRED_BLOCK_ALIGN];
        for (int i = 0; i < samples.length; i++) {
            short value = toPcm16(samples[i]);
            out[2 * i] = (byte) (value & 0xFF);
            out[2 * i + 1] = (byte) ((value >>> 8) & 0xFF);
        }
        return out;
    }

    /**
     * Decodes PCM16LE bytes into float samples in [-1, 1]. A trailing odd byte is ignored.
     */
    public static float[] fromPcm16Le(byte[] pcm, int offset, int length) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (offset < 0 || length < 0 || offset + length > pcm.length) {
            throw new IllegalArgumentException(
                    "Invalid range offset=" + offset + " length=" + length + " for " + pcm.length + " bytes");
        }
        int count = length / REQUIRED_BLOCK_ALIGN;
        float[] samples = new float[count];
        for (int i = 0; i < count; i++) {
            int lo = pcm[offset + 2 * i] & 0xFF;
            int hi = pcm[offset + 2 * i + 1];
            short value = (short) ((hi << 8) | lo);
            samples[i] = value / PCM16_SCALE;
        }
        return samples;
    }

    static short toPcm16(float sample) {
        float clamped = Math.max(-1f, Math.min(1f, sample));
        return (short) (clamped * PCM16_SCALE);
    }

    /**
     * Root-mean-square energy of the samples; 0 for an empty array.
     */
    public static double rms(float[] samples) {
        if (samples == null || samples.length == 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (float s : samples) {
            sumSquares += (double) s * s;
        }
        return Math.sqrt(sumSquares / samples.length);
    }

    /**
     * Linear-interpolation resampler. Returns the input unchanged when the rates match.
     */
    public static float[] resample(float[] samples, int fromRate, int toRate) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (fromRate <= 0 || toRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive, got " + fromRate + " -> " + toRate);
        }
        if (fromRate == toRate || samples.length == 0) {
            return samples;
        }
        int outLength = (int) ((long) samples.length * toRate / fromRate);
        float[] out = new float[outLength];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < outLength; i++) {
            double pos = i * step;
            int index = (int) pos;
            double frac = pos - index;
            float a = samples[Math.min(index, samples.length - 1)];
            float b = samples[Math.min(index + 1, samples.length - 1)];
            out[i] = (float) (a + (b - a) * frac);
        }
        return out;
    }
}
