package com.phillippitts.meetingscribe.service.stt;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.service.audio.AudioFormat;
import com.phillippitts.meetingscribe.service.audio.WavEncoder;
import com.phillippitts.meetingscribe.service.stt.cloud.AudioContainerFormat;
import com.phillippitts.meetingscribe.service.stt.cloud.SttProvider;

import java.util.List;
import java.util.Objects;

/**
 * {@link TranscriptionBackend} that encodes each window as a 16 kHz PCM16 WAV payload and uploads it
 * through an {@link SttProvider}. The language hint is not forwarded; remote providers detect it.
 */
public class CloudTranscriptionBackend implements TranscriptionBackend {

    private final SttProvider provider;

    public CloudTranscriptionBackend(SttProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    @Override
    public List<TranscriptionSegment> transcribe(float[] samples, int sampleRate, String languageHint) {
        if (samples == null || samples.length == 0) {
            throw new IllegalArgumentException("samples must not be null or empty");
        }
        if (sampleRate != AudioFormat.REQUIRED_SAMPLE_RATE) {
            throw new IllegalArgumentException(
                    "WAV payloads are encoded at " + AudioFormat.REQUIRED_SAMPLE_RATE + " Hz, got: " + sampleRate);
        }
        return provider.transcribe(WavEncoder.encode(samples), AudioContainerFormat.WAV);
    }

    @Override
    public String getBackendName() {
        return provider.getProviderName();
    }

    @Override
    public boolean isHealthy() {
        return provider.isConfigured();
    }
}
