package com.phillippitts.meetingscribe.service.audio;

/**
 * Single source of truth for the pipeline's audio format.
 *
 * <p>In memory: mono float32 samples at 16 kHz. On the wire (WAV payloads for backends):
 * 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Sample rate of every chunk, buffer and backend payload, in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Bits per sample in encoded payloads. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Mono. */
    public static final int REQUIRED_CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean REQUIRED_SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per PCM frame. */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second of encoded audio. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /** Scale applied to clamped float samples when encoding to int16. */
    public static final float PCM16_SCALE = 32767f;

    // RIFF/WAVE header layout (canonical 44-byte PCM header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_FORMAT_PCM = 1;
    public static final int WAV_FMT_CHUNK_SIZE = 16;
    public static final int WAV_AUDIO_FORMAT_OFFSET = 20;        // 2 bytes (LE)
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)
    public static final int WAV_DATA_SIZE_OFFSET = 40;           // 4 bytes (LE)

    private AudioFormat() {}

    /**
     * Duration in seconds of {@code sampleCount} samples at the pipeline sample rate.
     */
    public static double durationSeconds(int sampleCount) {
        return (double) sampleCount / REQUIRED_SAMPLE_RATE;
    }

    /**
     * Number of samples covering {@code seconds} at the pipeline sample rate, truncated.
     */
    public static int samplesFor(double seconds) {
        return (int) (seconds * REQUIRED_SAMPLE_RATE);
    }
}
