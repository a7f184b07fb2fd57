package com.phillippitts.meetingscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the transcription pipeline.
 *
 * <p>Meters (prefix {@code meetingscribe.pipeline}):
 * <ul>
 *   <li>{@code .dispatched} - windows sent to a backend, tagged by speaker</li>
 *   <li>{@code .latency} - backend call time, tagged by backend</li>
 *   <li>{@code .segments} - segments emitted, tagged by speaker</li>
 *   <li>{@code .failure} - dropped windows, tagged by backend and reason</li>
 *   <li>{@code .stale} - results discarded because a newer run started</li>
 *   <li>{@code .trimmed.samples} - samples discarded by backpressure trimming, tagged by speaker</li>
 *   <li>{@code .diarization} - diarization runs, tagged by outcome</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    static final String METRIC_PREFIX = "meetingscribe.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementDispatched(String speaker) {
        Counter.builder(METRIC_PREFIX + ".dispatched")
                .description("Speaker windows dispatched to a transcription backend")
                .tag("speaker", speaker)
                .register(registry)
                .increment();
    }

    /**
     * @param backendName   backend that served the call
     * @param durationNanos call duration in nanoseconds
     */
    public void recordLatency(String backendName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a transcription backend for one window")
                .tag("backend", backendName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSegments(String speaker, int count) {
        Counter.builder(METRIC_PREFIX + ".segments")
                .description("Transcript segments emitted")
                .tag("speaker", speaker)
                .register(registry)
                .increment(count);
    }

    /**
     * @param backendName backend that failed
     * @param reason      short failure class (exception simple name, "rejected")
     */
    public void incrementFailure(String backendName, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Speaker windows dropped after a backend failure")
                .tag("backend", backendName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementStale() {
        Counter.builder(METRIC_PREFIX + ".stale")
                .description("Backend results discarded because the pipeline restarted")
                .register(registry)
                .increment();
    }

    public void recordTrimmedSamples(String speaker, int samples) {
        DistributionSummary.builder(METRIC_PREFIX + ".trimmed.samples")
                .description("Samples discarded by backpressure trimming")
                .baseUnit("samples")
                .tag("speaker", speaker)
                .register(registry)
                .record(samples);
    }

    /**
     * @param outcome "success", "empty", "unavailable" or "failure"
     */
    public void incrementDiarization(String outcome) {
        Counter.builder(METRIC_PREFIX + ".diarization")
                .description("Diarization runs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
