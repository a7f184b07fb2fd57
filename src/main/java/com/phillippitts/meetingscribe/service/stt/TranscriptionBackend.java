package com.phillippitts.meetingscribe.service.stt;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.TranscriptionException;

import java.util.List;

/**
 * What the speaker window dispatcher calls to turn a window of samples into text.
 *
 * <p>One implementation is selected at startup ({@code transcription.backend=local|cloud}):
 * {@link LocalEngineTranscriptionBackend} runs an {@link SttEngine} on the samples directly,
 * {@link CloudTranscriptionBackend} encodes them as WAV and uploads them.
 *
 * <p>Implementations are called from several transcription threads at once, at most once per
 * speaker at a time, and never while the dispatcher holds its lock.
 */
public interface TranscriptionBackend {

    /**
     * @param samples      mono float32 samples of one speaker window
     * @param sampleRate   sample rate in Hz
     * @param languageHint ISO 639-1 code or null; remote backends may ignore it
     * @return segments timed relative to the first sample of {@code samples}
     * @throws TranscriptionException if the call fails; the dispatcher drops the window
     */
    List<TranscriptionSegment> transcribe(float[] samples, int sampleRate, String languageHint);

    String getBackendName();

    boolean isHealthy();
}
