package com.phillippitts.meetingscribe.service.vad;

import com.phillippitts.meetingscribe.config.properties.VadProperties;
import com.phillippitts.meetingscribe.domain.LabeledAudioChunk;
import com.phillippitts.meetingscribe.service.audio.PcmConverter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Energy-based voice activity gate with a hold-open window.
 *
 * <p>A chunk whose RMS energy exceeds {@code 10^(thresholdDb/20)} is speech: it passes and becomes the
 * last speech time. A quieter chunk still passes while {@code timestamp - lastSpeechTime} is below the
 * hold-open window, so word endings and short pauses are kept. Anything else is dropped.
 *
 * <p>The last speech time is a single value shared by every speaker routed through this gate: speech
 * from one source holds the gate open for silence from the other. A per-speaker variant would key it by
 * {@link LabeledAudioChunk#speaker()}.
 *
 * <p>Thread-safe.
 */
@Component
public class VoiceActivityGate {

    private static final Logger LOG = LogManager.getLogger(VoiceActivityGate.class);

    private final double thresholdDb;
    private final double linearThreshold;
    private final double holdOpenWindowSeconds;

    private final ReentrantLock lock = new ReentrantLock();
    private Double lastSpeechTime;
    private long passedCount;
    private long filteredCount;

    @Autowired
    public VoiceActivityGate(VadProperties properties) {
        this(properties.getThresholdDb(), properties.getHoldOpenWindowSeconds());
    }

    public VoiceActivityGate(double thresholdDb, double holdOpenWindowSeconds) {
        if (holdOpenWindowSeconds < 0) {
            throw new IllegalArgumentException("holdOpenWindowSeconds must be >= 0, got: " + holdOpenWindowSeconds);
        }
        this.thresholdDb = thresholdDb;
        this.linearThreshold = Math.pow(10.0, thresholdDb / 20.0);
        this.holdOpenWindowSeconds = holdOpenWindowSeconds;
    }

    /**
     * Decides whether a chunk carries speech.
     *
     * @return the same chunk if it passes, empty if it is dropped
     */
    public Optional<LabeledAudioChunk> filter(LabeledAudioChunk chunk) {
        double rms = PcmConverter.rms(chunk.samples());
        boolean speech = rms > linearThreshold;

        lock.lock();
        try {
            boolean pass;
            if (speech) {
                lastSpeechTime = chunk.timestamp();
                pass = true;
            } else {
                pass = lastSpeechTime != null && (chunk.timestamp() - lastSpeechTime) < holdOpenWindowSeconds;
            }
            if (pass) {
                passedCount++;
            } else {
                filteredCount++;
            }
            long total = passedCount + filteredCount;
            if (total <= 5 || total % 50 == 0) {
                LOG.debug("VAD {} chunk from {} at t={} (rms={}, speech={}, passed={}, filtered={})",
                        pass ? "passed" : "dropped", chunk.speaker(), chunk.timestamp(),
                        String.format("%.5f", rms), speech, passedCount, filteredCount);
            }
            return pass ? Optional.of(chunk) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets the last speech time and zeroes the counters; called when a new session starts.
     */
    public void reset() {
        lock.lock();
        try {
            lastSpeechTime = null;
            passedCount = 0;
            filteredCount = 0;
        } finally {
            lock.unlock();
        }
    }

    public long getPassedCount() {
        lock.lock();
        try {
            return passedCount;
        } finally {
            lock.unlock();
        }
    }

    public long getFilteredCount() {
        lock.lock();
        try {
            return filteredCount;
        } finally {
            lock.unlock();
        }
    }

    public double getThresholdDb() {
        return thresholdDb;
    }

    double getLinearThreshold() {
        return linearThreshold;
    }

    public double getHoldOpenWindowSeconds() {
        return holdOpenWindowSeconds;
    }
}
