package com.phillippitts.meetingscribe.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.WAV_FMT_CHUNK_SIZE;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.WAV_FORMAT_PCM;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Wraps float samples in a minimal RIFF/WAVE container: 16 kHz, 16-bit signed PCM, mono, little-endian.
 *
 * <p>Used for cloud upload payloads (in memory) and for whisper.cpp and diarization CLI input (temp files).
 * The output is deterministic for a given sample array.
 */
public final class WavEncoder {

    private WavEncoder() {}

    /**
     * Encodes samples into an in-memory WAV byte array (44-byte header + PCM16LE data).
     */
    public static byte[] encode(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        byte[] pcm = PcmConverter.toPcm16Le(samples);
        ByteArrayOutputStream out = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            writeTo(pcm, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode WAV payload", e);
        }
        return out.toByteArray();
    }

    /**
     * Writes samples as a WAV file, creating or overwriting {@code wavPath}.
     */
    public static void write(float[] samples, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            writeTo(PcmConverter.toPcm16Le(samples), os);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeTo(byte[] pcm, OutputStream os) throws IOException {
        os.write(header(pcm.length));
        os.write(pcm);
        os.flush();
    }

    static byte[] header(int dataSize) {
        ByteBuffer header = ByteBuffer.allocate(WAV_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        header.put("RIFF".getBytes(StandardCharsets.US_ASCII))
                .putInt(WAV_HEADER_SIZE - 8 + dataSize)
                .put("WAVE".getBytes(StandardCharsets.US_ASCII))
                .put("fmt ".getBytes(StandardCharsets.US_ASCII))
                .putInt(WAV_FMT_CHUNK_SIZE)
                .putShort((short) WAV_FORMAT_PCM)
                .putShort((short) REQUIRED_CHANNELS)
                .putInt(REQUIRED_SAMPLE_RATE)
                .putInt(REQUIRED_BYTE_RATE)
                .putShort((short) REQUIRED_BLOCK_ALIGN)
                .putShort((short) REQUIRED_BITS_PER_SAMPLE)
                .put("data".getBytes(StandardCharsets.US_ASCII))
                .putInt(dataSize);
        return header.array();
    }
}
