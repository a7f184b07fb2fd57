package com.phillippitts.meetingscribe.service.stt;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.ModelNotFoundException;
import com.phillippitts.meetingscribe.exception.TranscriptionException;

import java.util.List;

/**
 * Contract for local speech-to-text engines that take raw samples.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with configuration (binary, model, parameters)</li>
 *   <li>{@link #initialize()} prepares the engine (may throw {@link ModelNotFoundException})</li>
 *   <li>{@link #transcribe(float[], int, String)} turns one speaker window into segments
 *       (may throw {@link TranscriptionException})</li>
 *   <li>{@link #close()} releases resources</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must allow concurrent transcriptions, one per speaker.
 *
 * @see LocalEngineTranscriptionBackend
 */
public interface SttEngine extends AutoCloseable {

    /**
     * Prepares the engine. Called once before the first transcription.
     *
     * @throws ModelNotFoundException if the model file cannot be found
     * @throws TranscriptionException if initialization fails for other reasons
     */
    void initialize();

    /**
     * Transcribes mono float samples.
     *
     * @param samples      mono float32 samples in [-1, 1]
     * @param sampleRate   sample rate in Hz (16000 in this pipeline)
     * @param languageHint ISO 639-1 code, or null to let the engine detect the language
     * @return segments with times relative to the first sample; empty when nothing was recognized
     * @throws TranscriptionException if transcription fails (timeout, process error, bad output)
     * @throws IllegalArgumentException if samples is null or empty, or sampleRate is not positive
     */
    List<TranscriptionSegment> transcribe(float[] samples, int sampleRate, String languageHint);

    /**
     * @return engine name for logs, metrics and exceptions (e.g., "whisper")
     */
    String getEngineName();

    /**
     * @return true if the engine is initialized and not closed
     */
    boolean isHealthy();

    @Override
    void close();
}
