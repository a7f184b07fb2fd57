package com.phillippitts.meetingscribe.service.events;

import com.phillippitts.meetingscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Logs backend failure events at WARN at most once a minute per backend. Repeats inside the window
 * go to DEBUG and are counted; the count is reported with the next WARN.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onTranscriptionFailure(TranscriptionFailureEvent e) {
        long suppressed = suppressedBeforeWarn("transcription-" + e.backend());
        if (suppressed >= 0) {
            LOG.warn("Transcription backend '{}' failing: {} (dropped {}s of '{}' audio, {} similar failures suppressed)",
                    e.backend(), e.message(), TimeUtils.formatSeconds(e.droppedSeconds()), e.speaker(), suppressed);
        } else {
            LOG.debug("Transcription failure suppressed: backend={}, speaker={}, generation={}",
                    e.backend(), e.speaker(), e.generation());
        }
    }

    @EventListener
    void onDiarizationFailure(DiarizationFailureEvent e) {
        long suppressed = suppressedBeforeWarn("diarization-" + e.backend());
        if (suppressed >= 0) {
            LOG.warn("Diarization backend '{}' failed: {} ({} similar failures suppressed). "
                    + "Check diarization.* properties.", e.backend(), e.message(), suppressed);
        } else {
            LOG.debug("Diarization failure suppressed: backend={}", e.backend());
        }
    }

    boolean shouldLog(String key) {
        return suppressedBeforeWarn(key) >= 0;
    }

    /**
     * @return failures suppressed since the last WARN for {@code key}, or -1 if this one is suppressed too
     */
    private long suppressedBeforeWarn(String key) {
        Instant now = clock.instant();
        long[] result = {-1};
        windows.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev.openedAt(), now).compareTo(THROTTLE) > 0) {
                result[0] = prev == null ? 0 : prev.suppressed();
                return new Window(now, 0);
            }
            return new Window(prev.openedAt(), prev.suppressed() + 1);
        });
        return result[0];
    }

    private record Window(Instant openedAt, long suppressed) {
    }
}
