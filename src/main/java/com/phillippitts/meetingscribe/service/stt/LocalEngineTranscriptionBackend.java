package com.phillippitts.meetingscribe.service.stt;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * {@link TranscriptionBackend} that hands samples straight to a local {@link SttEngine}.
 *
 * <p>The engine is initialized on first use. If that fails (missing model, missing binary) the
 * exception fails the current window and the next window tries again, so a model installed while
 * the pipeline runs is picked up.
 */
public class LocalEngineTranscriptionBackend implements TranscriptionBackend {

    private static final Logger LOG = LogManager.getLogger(LocalEngineTranscriptionBackend.class);

    private final SttEngine engine;

    public LocalEngineTranscriptionBackend(SttEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public List<TranscriptionSegment> transcribe(float[] samples, int sampleRate, String languageHint) {
        if (!engine.isHealthy()) {
            LOG.info("Initializing {} engine on first use", engine.getEngineName());
            engine.initialize();
        }
        return engine.transcribe(samples, sampleRate, languageHint);
    }

    @Override
    public String getBackendName() {
        return engine.getEngineName();
    }

    @Override
    public boolean isHealthy() {
        return engine.isHealthy();
    }
}
