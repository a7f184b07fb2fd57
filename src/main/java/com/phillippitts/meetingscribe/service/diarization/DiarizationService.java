package com.phillippitts.meetingscribe.service.diarization;

import com.phillippitts.meetingscribe.domain.DiarizationResult;
import com.phillippitts.meetingscribe.domain.SpeakerSegment;
import com.phillippitts.meetingscribe.exception.DiarizationException;
import com.phillippitts.meetingscribe.service.audio.WavReader;
import com.phillippitts.meetingscribe.service.events.DiarizationFailureEvent;
import com.phillippitts.meetingscribe.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Offline "who spoke when" over a complete recording.
 *
 * <p>The most recent result is cached so callers can look up and rename speakers after the run.
 * An unavailable backend yields an empty result, not an exception.
 */
@Service
public class DiarizationService {

    private static final Logger LOG = LogManager.getLogger(DiarizationService.class);

    private final DiarizationBackend backend;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;

    private final ReentrantLock lock = new ReentrantLock();
    private DiarizationResult cached;

    public DiarizationService(DiarizationBackend backend, PipelineMetrics metrics,
                              ApplicationEventPublisher eventPublisher) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
    }

    /**
     * Reads a PCM WAV file, down-mixes it to mono and diarizes it.
     */
    public DiarizationResult diarize(Path wavFile) {
        Objects.requireNonNull(wavFile, "wavFile must not be null");
        LOG.info("Starting diarization for file: {}", wavFile.getFileName());
        WavReader.MonoAudio audio = WavReader.readMono(wavFile);
        DiarizationResult result = diarize(audio.samples(), audio.sampleRate());
        LOG.info("Diarization complete: {} speakers, {} segments", result.speakerCount(), result.segments().size());
        return result;
    }

    /**
     * @throws DiarizationException if an available backend fails
     */
    public DiarizationResult diarize(float[] samples, int sampleRate) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.length == 0) {
            metrics.incrementDiarization("empty");
            return cache(DiarizationResult.empty());
        }
        if (!backend.isModelAvailable()) {
            LOG.info("Diarization backend '{}' unavailable; returning empty result", backend.getBackendName());
            metrics.incrementDiarization("unavailable");
            return cache(DiarizationResult.empty());
        }
        List<SpeakerSegment> segments;
        try {
            segments = backend.process(samples, sampleRate);
        } catch (DiarizationException e) {
            metrics.incrementDiarization("failure");
            eventPublisher.publishEvent(
                    new DiarizationFailureEvent(backend.getBackendName(), Instant.now(), e.getMessage(), e));
            throw e;
        }
        metrics.incrementDiarization("success");
        return cache(DiarizationResult.fromSegments(segments));
    }

    public boolean isAvailable() {
        return backend.isModelAvailable();
    }

    public String getBackendName() {
        return backend.getBackendName();
    }

    /**
     * Speaker at {@code time} in the cached result; empty when nothing is cached or no segment covers it.
     */
    public Optional<String> speakerLabelAt(double time) {
        lock.lock();
        try {
            return cached == null ? Optional.empty() : cached.speakerLabelAt(time);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Relabels a speaker by replacing the cached result with a renamed copy. Results handed out earlier
     * keep their labels.
     *
     * @return number of segments relabeled; 0 when nothing is cached
     */
    public int renameSpeaker(String oldLabel, String newLabel) {
        lock.lock();
        try {
            if (cached == null) {
                return 0;
            }
            int renamed = cached.segmentCount(oldLabel);
            cached = cached.withRenamedSpeaker(oldLabel, newLabel);
            return renamed;
        } finally {
            lock.unlock();
        }
    }

    public Optional<DiarizationResult> cachedResult() {
        lock.lock();
        try {
            return Optional.ofNullable(cached);
        } finally {
            lock.unlock();
        }
    }

    private DiarizationResult cache(DiarizationResult result) {
        lock.lock();
        try {
            cached = result;
            return result;
        } finally {
            lock.unlock();
        }
    }
}
