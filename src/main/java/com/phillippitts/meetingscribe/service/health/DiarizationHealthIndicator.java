package com.phillippitts.meetingscribe.service.health;

import com.phillippitts.meetingscribe.service.diarization.DiarizationService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether speaker diarization is available.
 *
 * <p>Diarization is optional, so a missing model reports UP with {@code available=false} rather than
 * DOWN: transcription keeps working without it.
 */
@Component
public class DiarizationHealthIndicator implements HealthIndicator {

    private final DiarizationService diarizationService;

    public DiarizationHealthIndicator(DiarizationService diarizationService) {
        this.diarizationService = diarizationService;
    }

    @Override
    public Health health() {
        boolean available = diarizationService.isAvailable();
        return Health.up()
                .withDetail("available", available)
                .withDetail("backend", diarizationService.getBackendName())
                .withDetail("status", available ? "Diarization model accessible" : "Diarization model not installed")
                .build();
    }
}
