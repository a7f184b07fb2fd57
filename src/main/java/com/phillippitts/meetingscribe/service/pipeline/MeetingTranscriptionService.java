package com.phillippitts.meetingscribe.service.pipeline;

import com.phillippitts.meetingscribe.domain.AudioChunk;
import com.phillippitts.meetingscribe.domain.LabeledAudioChunk;
import com.phillippitts.meetingscribe.domain.TranscriptSegment;
import com.phillippitts.meetingscribe.service.stream.ChunkStream;
import com.phillippitts.meetingscribe.service.stream.StreamMerger;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for a meeting: merges the two capture streams and runs them through the
 * {@link SpeakerWindowDispatcher}.
 *
 * <p>Each {@link #start} opens a new session. The session id is put in the Log4j2 ThreadContext while
 * the worker tasks are submitted, so every log line of the session carries it.
 */
@Service
public class MeetingTranscriptionService {

    private static final Logger LOG = LogManager.getLogger(MeetingTranscriptionService.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final StreamMerger merger;
    private final SpeakerWindowDispatcher dispatcher;

    private final ReentrantLock lock = new ReentrantLock();
    private String sessionId;

    public MeetingTranscriptionService(StreamMerger merger, SpeakerWindowDispatcher dispatcher) {
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * Starts transcribing a meeting. A session already running is superseded.
     *
     * @param microphone  local speaker's capture stream
     * @param systemAudio remote participants' capture stream
     * @return transcript segments of this session
     */
    public ChunkStream<TranscriptSegment> start(ChunkStream<AudioChunk> microphone, ChunkStream<AudioChunk> systemAudio) {
        Objects.requireNonNull(microphone, "microphone stream must not be null");
        Objects.requireNonNull(systemAudio, "systemAudio stream must not be null");
        lock.lock();
        try {
            String id = UUID.randomUUID().toString().substring(0, 8);
            ThreadContext.put(MDC_SESSION_ID, id);
            try {
                LOG.info("Starting meeting transcription session");
                ChunkStream<LabeledAudioChunk> merged = merger.merge(microphone, systemAudio);
                ChunkStream<TranscriptSegment> transcript = dispatcher.start(merged);
                sessionId = id;
                return transcript;
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the current session, flushing buffered audio. Blocks until the transcript stream is complete.
     */
    @PreDestroy
    public void stop() {
        lock.lock();
        try {
            if (sessionId == null) {
                return;
            }
            ThreadContext.put(MDC_SESSION_ID, sessionId);
            try {
                dispatcher.stop();
                LOG.info("Meeting transcription session stopped");
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
                sessionId = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return dispatcher.isRunning();
    }

    public void setLanguageHint(String languageHint) {
        dispatcher.setLanguageHint(languageHint);
    }

    public Optional<String> currentSessionId() {
        lock.lock();
        try {
            return Optional.ofNullable(sessionId);
        } finally {
            lock.unlock();
        }
    }
}
