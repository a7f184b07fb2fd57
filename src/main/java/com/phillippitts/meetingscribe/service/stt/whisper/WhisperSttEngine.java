package com.phillippitts.meetingscribe.service.stt.whisper;

import com.phillippitts.meetingscribe.config.stt.SttConcurrencyProperties;
import com.phillippitts.meetingscribe.config.stt.WhisperConfig;
import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.ModelNotFoundException;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.service.audio.AudioFormat;
import com.phillippitts.meetingscribe.service.audio.WavEncoder;
import com.phillippitts.meetingscribe.service.stt.AbstractSttEngine;
import com.phillippitts.meetingscribe.service.stt.BackendNames;
import com.phillippitts.meetingscribe.service.stt.util.ConcurrencyGuard;
import com.phillippitts.meetingscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Local {@link com.phillippitts.meetingscribe.service.stt.SttEngine} backed by the whisper.cpp binary.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>Writes the samples to a temporary 16 kHz PCM16 WAV file with {@link WavEncoder}</li>
 *   <li>Invokes whisper.cpp in JSON mode via {@link WhisperProcessManager}</li>
 *   <li>Parses timed segments with {@link WhisperJsonParser} and deletes the temp file</li>
 *   <li>Caps parallel processes with a semaphore ({@code stt.concurrency.whisper-max})</li>
 * </ul>
 *
 * <p><b>Privacy:</b> never logs transcript text; only durations and character counts.
 *
 * @see WhisperProcessManager
 * @see WhisperConfig
 * @since 1.0
 */
@Component
public final class WhisperSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperSttEngine.class);

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;
    private final ConcurrencyGuard concurrencyGuard;

    WhisperSttEngine(WhisperConfig cfg, WhisperProcessManager manager) {
        this(cfg, manager, new ConcurrencyGuard(2, 1000, BackendNames.WHISPER));
    }

    @Autowired
    public WhisperSttEngine(WhisperConfig cfg,
                            SttConcurrencyProperties concurrencyProperties,
                            WhisperProcessManager manager) {
        this(cfg, manager, new ConcurrencyGuard(
                concurrencyProperties.whisperMax(), concurrencyProperties.acquireTimeoutMs(),
                BackendNames.WHISPER));
    }

    private WhisperSttEngine(WhisperConfig cfg, WhisperProcessManager manager, ConcurrencyGuard guard) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.concurrencyGuard = guard;
    }

    @Override
    protected void doInitialize() {
        if (!Files.isRegularFile(Path.of(cfg.modelPath()))) {
            throw new ModelNotFoundException(cfg.modelPath());
        }
        if (!Files.isExecutable(Path.of(cfg.binaryPath()))) {
            throw new TranscriptionException("whisper.cpp binary not executable: " + cfg.binaryPath(),
                    BackendNames.WHISPER);
        }
        LOG.info("Whisper engine initialized: bin={}, model={}, timeout={}s, lang={}, threads={}",
                cfg.binaryPath(), cfg.modelPath(), cfg.timeoutSeconds(), cfg.language(), cfg.threads());
    }

    @Override
    public List<TranscriptionSegment> transcribe(float[] samples, int sampleRate, String languageHint) {
        validateInput(samples, sampleRate);
        if (sampleRate != AudioFormat.REQUIRED_SAMPLE_RATE) {
            throw new IllegalArgumentException(
                    "whisper.cpp expects " + AudioFormat.REQUIRED_SAMPLE_RATE + " Hz, got: " + sampleRate);
        }
        try (ConcurrencyGuard.Permit permit = concurrencyGuard.acquire()) {
            ensureInitialized();
            Path wav = null;
            long startTime = System.nanoTime();
            try {
                wav = Files.createTempFile("whisper-", ".wav");
                WavEncoder.write(samples, wav);
                String stdout = manager.transcribe(wav, cfg, languageHint);
                List<TranscriptionSegment> segments =
                        WhisperJsonParser.parseSegments(stdout, AudioFormat.durationSeconds(samples.length));

                LOG.debug("Whisper transcribed {}s of audio in {} ms (segments={})",
                        AudioFormat.durationSeconds(samples.length), TimeUtils.elapsedMillis(startTime),
                        segments.size());
                return segments;
            } catch (Exception e) {
                throw wrapTranscriptionError(e);
            } finally {
                cleanupTempFile(wav);
            }
        }
    }

    private void cleanupTempFile(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp WAV {}: {}", wav, e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return BackendNames.WHISPER;
    }

    @Override
    protected void doClose() {
        LOG.info("Whisper engine closed");
    }
}
