package com.phillippitts.meetingscribe.service.stream;

import com.phillippitts.meetingscribe.domain.AudioChunk;
import com.phillippitts.meetingscribe.domain.AudioSource;
import com.phillippitts.meetingscribe.domain.LabeledAudioChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Merges the microphone and system-audio streams into one labeled stream.
 *
 * <p>Each input is read by its own task on the stream executor and every chunk is forwarded as soon as
 * it arrives, labeled from the stream it came from. Neither source waits on the other and no samples are
 * mixed. The merged stream completes once both inputs have completed. Cancelling the merged stream stops
 * both readers and cancels their inputs.
 */
@Component
public class StreamMerger {

    private static final Logger LOG = LogManager.getLogger(StreamMerger.class);

    /** How often a blocked reader re-checks whether the merged stream was cancelled. */
    static final long CANCEL_CHECK_MILLIS = 100;

    private final Executor streamExecutor;

    public StreamMerger(@Qualifier("streamExecutor") Executor streamExecutor) {
        this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor must not be null");
    }

    /**
     * Starts one reader per input and returns the merged stream immediately.
     */
    public ChunkStream<LabeledAudioChunk> merge(ChunkStream<AudioChunk> microphone,
                                                ChunkStream<AudioChunk> systemAudio) {
        Objects.requireNonNull(microphone, "microphone stream must not be null");
        Objects.requireNonNull(systemAudio, "systemAudio stream must not be null");

        ChunkStream<LabeledAudioChunk> merged = new ChunkStream<>("merged");
        AtomicInteger remaining = new AtomicInteger(2);
        streamExecutor.execute(() -> pump(microphone, AudioSource.MICROPHONE, merged, remaining));
        streamExecutor.execute(() -> pump(systemAudio, AudioSource.SYSTEM_AUDIO, merged, remaining));
        return merged;
    }

    private void pump(ChunkStream<AudioChunk> input, AudioSource source,
                      ChunkStream<LabeledAudioChunk> merged, AtomicInteger remaining) {
        long count = 0;
        try {
            while (!merged.isCancelled()) {
                AudioChunk chunk = input.next(CANCEL_CHECK_MILLIS, TimeUnit.MILLISECONDS);
                if (chunk == null) {
                    if (input.isFinished()) {
                        break;
                    }
                    continue;
                }
                count++;
                if (count <= 5 || count % 10 == 0) {
                    LOG.debug("Merger received {} chunk #{} ({} samples, t={})",
                            source, count, chunk.samples().length, chunk.timestamp());
                }
                LabeledAudioChunk labeled = new LabeledAudioChunk(
                        chunk.samples(), chunk.timestamp(), source.speakerLabel());
                if (!merged.emit(labeled)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Merger reader for {} interrupted after {} chunks", source, count);
        } finally {
            if (merged.isCancelled()) {
                input.cancel();
            }
            LOG.info("{} stream ended after {} chunks", source, count);
            if (remaining.decrementAndGet() == 0) {
                merged.complete();
                LOG.info("Stream merger finished");
            }
        }
    }
}
