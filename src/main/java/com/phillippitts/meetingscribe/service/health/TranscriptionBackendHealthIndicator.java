package com.phillippitts.meetingscribe.service.health;

import com.phillippitts.meetingscribe.service.stt.CloudTranscriptionBackend;
import com.phillippitts.meetingscribe.service.stt.TranscriptionBackend;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the selected transcription backend.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: backend ready (local engine initialized, or cloud provider configured)</li>
 *   <li>UNKNOWN: local engine not initialized yet; it initializes on the first window</li>
 *   <li>DOWN: cloud provider not configured</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class TranscriptionBackendHealthIndicator implements HealthIndicator {

    private final TranscriptionBackend backend;
    private final boolean lazilyInitialized;

    public TranscriptionBackendHealthIndicator(TranscriptionBackend backend) {
        this.backend = backend;
        this.lazilyInitialized = !(backend instanceof CloudTranscriptionBackend);
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        if (backend.isHealthy()) {
            builder.up().withDetail("status", "Backend ready");
        } else if (lazilyInitialized) {
            builder.unknown().withDetail("status", "Engine initializes on first window");
        } else {
            builder.down().withDetail("status", "Backend not configured");
        }
        return builder.withDetail("backend", backend.getBackendName()).build();
    }
}
