package com.phillippitts.meetingscribe.service.audio;

import com.phillippitts.meetingscribe.exception.InvalidAudioException;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads PCM WAV files into mono float samples, averaging channels when the file is multichannel.
 *
 * <p>Supports signed 16-bit little-endian PCM, which is what the capture side and
 * {@link WavEncoder} produce. The sample rate is reported, not converted.
 */
public final class WavReader {

    private WavReader() {}

    /**
     * Mono samples and the sample rate they were recorded at.
     */
    public record MonoAudio(float[] samples, int sampleRate) {
    }

    public static MonoAudio readMono(Path wavFile) {
        Objects.requireNonNull(wavFile, "wavFile must not be null");
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(wavFile));
             AudioInputStream in = AudioSystem.getAudioInputStream(raw)) {
            javax.sound.sampled.AudioFormat format = in.getFormat();
            if (format.getEncoding() != javax.sound.sampled.AudioFormat.Encoding.PCM_SIGNED
                    || format.getSampleSizeInBits() != 16 || format.isBigEndian()) {
                throw new InvalidAudioException("Unsupported WAV encoding " + format + " in " + wavFile);
            }
            int channels = format.getChannels();
            byte[] pcm = in.readAllBytes();
            float[] interleaved = PcmConverter.fromPcm16Le(pcm, 0, pcm.length - (pcm.length % 2));
            return new MonoAudio(downmix(interleaved, channels), (int) format.getSampleRate());
        } catch (UnsupportedAudioFileException e) {
            throw new InvalidAudioException("Not a readable audio file: " + wavFile, e);
        } catch (IOException e) {
            throw new InvalidAudioException("Failed to read " + wavFile + ": " + e.getMessage(), e);
        }
    }

    static float[] downmix(float[] interleaved, int channels) {
        if (channels <= 1) {
            return interleaved;
        }
        int frames = interleaved.length / channels;
        float[] mono = new float[frames];
        for (int f = 0; f < frames; f++) {
            float sum = 0f;
            for (int c = 0; c < channels; c++) {
                sum += interleaved[f * channels + c];
            }
            mono[f] = sum / channels;
        }
        return mono;
    }
}
