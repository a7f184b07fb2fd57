package com.phillippitts.meetingscribe.service.stt;

import com.phillippitts.meetingscribe.exception.TranscriptionException;
import jakarta.annotation.PreDestroy;

/**
 * Lifecycle and input checks shared by local engines.
 *
 * <p>An engine moves {@code NEW -> READY -> CLOSED}; {@link #initialize()} on a closed engine makes it
 * {@code READY} again. Subclass hooks run under the state lock, so {@link #doInitialize()} never races
 * {@link #doClose()}. Transcription calls are not serialized here.
 *
 * @see com.phillippitts.meetingscribe.service.stt.whisper.WhisperSttEngine
 */
public abstract class AbstractSttEngine implements SttEngine {

    private enum State { NEW, READY, CLOSED }

    private final Object stateLock = new Object();
    private State state = State.NEW;

    @Override
    public final void initialize() {
        synchronized (stateLock) {
            if (state == State.READY) {
                return;
            }
            doInitialize();
            state = State.READY;
        }
    }

    /**
     * Checks models and binaries. Throws {@link TranscriptionException} or
     * {@link com.phillippitts.meetingscribe.exception.ModelNotFoundException}; the engine stays unready.
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (stateLock) {
            return state == State.READY;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (stateLock) {
            if (state != State.READY) {
                state = State.CLOSED;
                return;
            }
            doClose();
            state = State.CLOSED;
        }
    }

    /** Releases engine resources; should log rather than throw. */
    protected abstract void doClose();

    protected final void ensureInitialized() {
        synchronized (stateLock) {
            if (state != State.READY) {
                throw new TranscriptionException(
                        getEngineName() + " engine not initialized (state=" + state + ")", getEngineName());
            }
        }
    }

    protected static void validateInput(float[] samples, int sampleRate) {
        if (samples == null || samples.length == 0) {
            throw new IllegalArgumentException("samples must not be null or empty");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
    }

    /**
     * Passes {@link TranscriptionException} through and wraps anything else with the engine name.
     */
    protected final TranscriptionException wrapTranscriptionError(Exception exception) {
        if (exception instanceof TranscriptionException te) {
            return te;
        }
        return new TranscriptionException(getEngineName() + " transcription failed: " + exception.getMessage(),
                getEngineName(), exception);
    }
}
