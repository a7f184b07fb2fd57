package com.phillippitts.meetingscribe.service.pipeline;

import com.phillippitts.meetingscribe.config.properties.PipelineProperties;
import com.phillippitts.meetingscribe.domain.AppLanguage;
import com.phillippitts.meetingscribe.domain.LabeledAudioChunk;
import com.phillippitts.meetingscribe.domain.TranscriptSegment;
import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.service.audio.AudioFormat;
import com.phillippitts.meetingscribe.service.events.TranscriptionFailureEvent;
import com.phillippitts.meetingscribe.service.language.LanguageDetector;
import com.phillippitts.meetingscribe.service.metrics.PipelineMetrics;
import com.phillippitts.meetingscribe.service.stream.ChunkStream;
import com.phillippitts.meetingscribe.service.stt.TranscriptionBackend;
import com.phillippitts.meetingscribe.service.vad.VoiceActivityGate;
import com.phillippitts.meetingscribe.util.LogSanitizer;
import com.phillippitts.meetingscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns the merged, labeled audio stream into speaker-attributed transcript segments.
 *
 * <p>Chunks that pass the {@link VoiceActivityGate} accumulate in one buffer per speaker. Once a buffer
 * holds {@code minBufferDurationSeconds} of audio and that speaker has no transcription in flight, the
 * buffer is snapshotted, cleared and handed to the transcription executor. While a speaker's
 * transcription is in flight its buffer keeps growing; past {@code maxBufferDurationSeconds} the oldest
 * samples are discarded down to the minimum window.
 *
 * <p>Every {@link #start} begins a new generation. Work captured under an older generation (consumption
 * loops, transcription completions) checks its generation before touching state and exits quietly when
 * superseded.
 *
 * <p>Threading: one {@link ReentrantLock} guards buffers, the in-flight set, the generation, the running
 * flag and emission. Backend calls always run outside the lock.
 */
@Component
public class SpeakerWindowDispatcher {

    private static final Logger LOG = LogManager.getLogger(SpeakerWindowDispatcher.class);

    static final String MDC_GENERATION = "generation";
    static final String MDC_SPEAKER = "speaker";

    private final TranscriptionBackend backend;
    private final VoiceActivityGate gate;
    private final LanguageDetector languageDetector;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor streamExecutor;
    private final Executor transcriptionExecutor;

    private final int sampleRate = AudioFormat.REQUIRED_SAMPLE_RATE;
    private final double minBufferDurationSeconds;
    private final double maxBufferDurationSeconds;
    private final long drainPollIntervalMs;
    private final long stopDrainTimeoutMs;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SpeakerBuffer> buffers = new LinkedHashMap<>();
    private final Set<String> active = new HashSet<>();
    private long generation;
    private boolean running;
    private ChunkStream<LabeledAudioChunk> input;
    private ChunkStream<TranscriptSegment> output;
    private CompletableFuture<Void> loopFuture;

    private volatile String languageHint;

    public SpeakerWindowDispatcher(TranscriptionBackend backend,
                                   VoiceActivityGate gate,
                                   LanguageDetector languageDetector,
                                   PipelineMetrics metrics,
                                   ApplicationEventPublisher eventPublisher,
                                   PipelineProperties properties,
                                   @Qualifier("streamExecutor") Executor streamExecutor,
                                   @Qualifier("transcriptionExecutor") Executor transcriptionExecutor) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.languageDetector = Objects.requireNonNull(languageDetector, "languageDetector must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor must not be null");
        this.transcriptionExecutor = Objects.requireNonNull(transcriptionExecutor,
                "transcriptionExecutor must not be null");
        this.minBufferDurationSeconds = properties.getMinBufferDurationSeconds();
        this.maxBufferDurationSeconds = properties.getMaxBufferDurationSeconds();
        this.drainPollIntervalMs = properties.getDrainPollIntervalMs();
        this.stopDrainTimeoutMs = properties.getStopDrainTimeoutMs();
        setLanguageHint(properties.getLanguageHint());
    }

    /**
     * Begins a new run over {@code merged}, superseding any run in progress.
     *
     * <p>The previous run's input is cancelled and its output completed without flushing. Buffers, the
     * in-flight set and the voice activity gate are reset.
     *
     * @return stream of transcript segments; completes after the input ends and every buffer is drained,
     *         or when {@link #stop()} returns
     */
    public ChunkStream<TranscriptSegment> start(ChunkStream<LabeledAudioChunk> merged) {
        Objects.requireNonNull(merged, "merged stream must not be null");
        ChunkStream<TranscriptSegment> out = new ChunkStream<>("transcript");
        lock.lock();
        try {
            generation++;
            long gen = generation;
            if (input != null) {
                input.cancel();
            }
            if (output != null) {
                output.complete();
            }
            buffers.clear();
            active.clear();
            gate.reset();
            input = merged;
            output = out;
            running = true;
            LOG.info("Starting transcription pipeline generation {} (window {}s-{}s, backend={})",
                    gen, minBufferDurationSeconds, maxBufferDurationSeconds, backend.getBackendName());
            try {
                loopFuture = CompletableFuture.runAsync(() -> consume(merged, gen), streamExecutor);
            } catch (RejectedExecutionException e) {
                running = false;
                out.complete();
                throw new IllegalStateException("No stream thread available to run the pipeline", e);
            }
        } finally {
            lock.unlock();
        }
        return out;
    }

    /**
     * Stops the current run and flushes what is buffered.
     *
     * <p>Waits (bounded by {@code stopDrainTimeoutMs}) for the consumption loop and for in-flight
     * transcriptions, then transcribes every non-empty buffer on the calling thread. Buffers of speakers
     * still in flight after the wait are dropped with a warning. When this returns
     * the output stream is complete and nothing more is emitted. No-op when not running.
     */
    public void stop() {
        ChunkStream<LabeledAudioChunk> in;
        CompletableFuture<Void> loop;
        long gen;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            in = input;
            loop = loopFuture;
            gen = generation;
        } finally {
            lock.unlock();
        }

        LOG.info("Stopping transcription pipeline generation {}", gen);
        in.cancel();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(stopDrainTimeoutMs);
        boolean interrupted = !awaitLoop(loop, deadline) || !awaitInFlight(gen, deadline);

        drainBuffers(gen);

        lock.lock();
        try {
            if (generation == gen) {
                output.complete();
                buffers.clear();
                active.clear();
            }
        } finally {
            lock.unlock();
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Transcription pipeline generation {} stopped", gen);
    }

    /**
     * Sets the ISO 639-1 language hint passed to the backend. Null or blank means auto-detect.
     */
    public void setLanguageHint(String hint) {
        this.languageHint = hint == null || hint.isBlank() ? null : hint.trim();
    }

    public String getLanguageHint() {
        return languageHint;
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    private void consume(ChunkStream<LabeledAudioChunk> in, long gen) {
        ThreadContext.put(MDC_GENERATION, String.valueOf(gen));
        long received = 0;
        try {
            LabeledAudioChunk chunk;
            while ((chunk = in.next()) != null) {
                if (!isCurrent(gen)) {
                    LOG.debug("Generation {} superseded, leaving consumption loop", gen);
                    return;
                }
                received++;
                if (received <= 5 || received % 10 == 0) {
                    LOG.debug("Chunk #{} from [{}]: {} samples", received, chunk.speaker(), chunk.samples().length);
                }
                ingest(chunk, gen);
            }
            LOG.info("Input ended for generation {} after {} chunks ({} passed voice activity gate)",
                    gen, received, gate.getPassedCount());
            finishNaturally(gen);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Consumption loop for generation {} interrupted", gen);
        } finally {
            ThreadContext.remove(MDC_GENERATION);
        }
    }

    /**
     * Runs a chunk through the voice activity gate, adds it to its speaker's buffer and dispatches or
     * trims the buffer as needed. Ignored when {@code gen} is no longer the running generation; the gate
     * is only consulted after that check so a superseded loop cannot touch the new run's gate state.
     */
    void ingest(LabeledAudioChunk chunk, long gen) {
        Window window = null;
        String speaker = chunk.speaker();
        lock.lock();
        try {
            if (!running || generation != gen) {
                return;
            }
            if (gate.filter(chunk).isEmpty()) {
                return;
            }
            SpeakerBuffer buffer = buffers.computeIfAbsent(speaker, s -> new SpeakerBuffer(sampleRate));
            buffer.append(chunk);
            double duration = buffer.durationSeconds();
            if (duration >= minBufferDurationSeconds && !active.contains(speaker)) {
                window = new Window(speaker, buffer.snapshot(), buffer.startTime(), gen);
                buffer.clear();
                active.add(speaker);
            } else if (duration >= maxBufferDurationSeconds && active.contains(speaker)) {
                int trimmed = buffer.trimTo(AudioFormat.samplesFor(minBufferDurationSeconds));
                if (trimmed > 0) {
                    metrics.recordTrimmedSamples(speaker, trimmed);
                    LOG.debug("Trimmed {} samples from [{}] while its transcription is in flight", trimmed, speaker);
                }
            }
        } finally {
            lock.unlock();
        }
        if (window != null) {
            submit(window);
        }
    }

    private void submit(Window window) {
        metrics.incrementDispatched(window.speaker());
        LOG.debug("Dispatching {}s window for [{}] starting at {}s",
                TimeUtils.formatSeconds(window.durationSeconds()), window.speaker(), window.startTime());
        try {
            transcriptionExecutor.execute(() -> transcribeAndEmit(window));
        } catch (RejectedExecutionException e) {
            release(window);
            reportFailure(window, "rejected", e);
        }
    }

    /**
     * Calls the backend for one window and emits the results if the window's generation is still current.
     * The speaker leaves the in-flight set on every path, including errors and a null result.
     */
    private void transcribeAndEmit(Window window) {
        ThreadContext.put(MDC_SPEAKER, window.speaker());
        boolean settled = false;
        try {
            long startNanos = System.nanoTime();
            List<TranscriptionSegment> segments = backend.transcribe(window.samples(), sampleRate, languageHint);
            if (segments == null) {
                throw new TranscriptionException("Backend returned no result", backend.getBackendName());
            }
            metrics.recordLatency(backend.getBackendName(), System.nanoTime() - startNanos);
            emit(window, toTranscript(window, segments));
            settled = true;
        } catch (RuntimeException | Error e) {
            release(window);
            settled = true;
            if (isGeneration(window.generation())) {
                reportFailure(window, e.getClass().getSimpleName(), e);
            } else {
                metrics.incrementStale();
                LOG.debug("Ignoring failure for [{}] from superseded generation {}: {}",
                        window.speaker(), window.generation(), e.toString());
            }
        } finally {
            if (!settled) {
                release(window);
            }
            ThreadContext.remove(MDC_SPEAKER);
        }
    }

    private List<TranscriptSegment> toTranscript(Window window, List<TranscriptionSegment> segments) {
        List<TranscriptSegment> result = new ArrayList<>(segments.size());
        for (TranscriptionSegment segment : segments) {
            Optional<AppLanguage> language = languageDetector.detect(segment.text());
            result.add(TranscriptSegment.of(segment, window.startTime(), window.speaker(), language));
        }
        return result;
    }

    private void emit(Window window, List<TranscriptSegment> segments) {
        lock.lock();
        try {
            if (generation != window.generation()) {
                metrics.incrementStale();
                LOG.debug("Discarding {} segments for [{}] from superseded generation {}",
                        segments.size(), window.speaker(), window.generation());
                return;
            }
            int emitted = 0;
            for (TranscriptSegment segment : segments) {
                if (output.emit(segment)) {
                    emitted++;
                    LOG.debug("Segment [{}] {}s-{}s {}", segment.speaker(), TimeUtils.formatSeconds(segment.startTime()),
                            TimeUtils.formatSeconds(segment.endTime()), LogSanitizer.describeText(segment.text()));
                }
            }
            if (emitted > 0) {
                metrics.incrementSegments(window.speaker(), emitted);
            }
            LOG.debug("Emitted {} segments for [{}]", emitted, window.speaker());
            active.remove(window.speaker());
        } finally {
            lock.unlock();
        }
    }

    private void release(Window window) {
        lock.lock();
        try {
            if (generation == window.generation()) {
                active.remove(window.speaker());
            }
        } finally {
            lock.unlock();
        }
    }

    private void reportFailure(Window window, String reason, Throwable e) {
        String backendName = backend.getBackendName();
        LOG.warn("Dropping {}s of [{}] audio: {} transcription failed ({})",
                TimeUtils.formatSeconds(window.durationSeconds()), window.speaker(), backendName, e.getMessage());
        metrics.incrementFailure(backendName, reason);
        eventPublisher.publishEvent(new TranscriptionFailureEvent(
                backendName,
                window.speaker(),
                window.generation(),
                window.durationSeconds(),
                Instant.now(),
                e.getMessage() == null ? reason : e.getMessage(),
                e,
                Map.of("reason", reason, "samples", String.valueOf(window.samples().length))));
    }

    /**
     * Natural end of input: wait for in-flight work, flush every buffer, complete the output.
     */
    private void finishNaturally(long gen) throws InterruptedException {
        while (true) {
            lock.lock();
            try {
                if (!running || generation != gen) {
                    LOG.debug("Generation {} stopped or superseded, skipping flush", gen);
                    return;
                }
                if (active.isEmpty()) {
                    break;
                }
            } finally {
                lock.unlock();
            }
            Thread.sleep(drainPollIntervalMs);
        }

        drainBuffers(gen);

        lock.lock();
        try {
            if (running && generation == gen) {
                output.complete();
                buffers.clear();
                active.clear();
                running = false;
                LOG.info("Transcription pipeline generation {} finished", gen);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Transcribes every non-empty buffer of {@code gen} on the calling thread. A speaker whose
     * transcription is still in flight keeps at most one call running, so its buffer is dropped instead.
     */
    private void drainBuffers(long gen) {
        List<Window> windows = new ArrayList<>();
        lock.lock();
        try {
            if (generation != gen) {
                return;
            }
            for (Map.Entry<String, SpeakerBuffer> entry : buffers.entrySet()) {
                SpeakerBuffer buffer = entry.getValue();
                if (buffer.isEmpty()) {
                    continue;
                }
                if (active.contains(entry.getKey())) {
                    LOG.warn("Dropping {}s buffered for [{}]: its transcription is still in flight",
                            TimeUtils.formatSeconds(buffer.durationSeconds()), entry.getKey());
                    buffer.clear();
                } else {
                    windows.add(new Window(entry.getKey(), buffer.snapshot(), buffer.startTime(), gen));
                    buffer.clear();
                }
            }
        } finally {
            lock.unlock();
        }
        for (Window window : windows) {
            LOG.debug("Flushing {}s remaining for [{}]",
                    TimeUtils.formatSeconds(window.durationSeconds()), window.speaker());
            metrics.incrementDispatched(window.speaker());
            transcribeAndEmit(window);
        }
    }

    /**
     * @return false if interrupted while waiting
     */
    private boolean awaitLoop(CompletableFuture<Void> loop, long deadlineNanos) {
        if (loop == null) {
            return true;
        }
        try {
            loop.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Consumption loop did not exit within {} ms", stopDrainTimeoutMs);
        } catch (ExecutionException e) {
            LOG.warn("Consumption loop failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            return false;
        }
        return true;
    }

    /**
     * Polls until no transcription of {@code gen} is in flight or the deadline passes.
     *
     * @return false if interrupted while waiting
     */
    private boolean awaitInFlight(long gen, long deadlineNanos) {
        while (true) {
            lock.lock();
            try {
                if (generation != gen || active.isEmpty()) {
                    return true;
                }
            } finally {
                lock.unlock();
            }
            if (System.nanoTime() >= deadlineNanos) {
                LOG.warn("In-flight transcriptions still pending after {} ms; their results will be dropped",
                        stopDrainTimeoutMs);
                return true;
            }
            try {
                Thread.sleep(drainPollIntervalMs);
            } catch (InterruptedException e) {
                return false;
            }
        }
    }

    private boolean isGeneration(long gen) {
        lock.lock();
        try {
            return generation == gen;
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrent(long gen) {
        lock.lock();
        try {
            return running && generation == gen;
        } finally {
            lock.unlock();
        }
    }

    long currentGeneration() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    double bufferedDuration(String speaker) {
        lock.lock();
        try {
            SpeakerBuffer buffer = buffers.get(speaker);
            return buffer == null ? 0.0 : buffer.durationSeconds();
        } finally {
            lock.unlock();
        }
    }

    double bufferStartTime(String speaker) {
        lock.lock();
        try {
            SpeakerBuffer buffer = buffers.get(speaker);
            return buffer == null ? 0.0 : buffer.startTime();
        } finally {
            lock.unlock();
        }
    }

    boolean isActive(String speaker) {
        lock.lock();
        try {
            return active.contains(speaker);
        } finally {
            lock.unlock();
        }
    }

    private record Window(String speaker, float[] samples, double startTime, long generation) {
        double durationSeconds() {
            return AudioFormat.durationSeconds(samples.length);
        }
    }
}
