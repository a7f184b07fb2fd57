package com.phillippitts.meetingscribe.service.health;

import com.phillippitts.meetingscribe.service.diarization.DiarizationService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DiarizationHealthIndicatorTest {

    @Test
    void missingModelStillReportsUp() {
        DiarizationService service = mock(DiarizationService.class);
        when(service.isAvailable()).thenReturn(false);
        when(service.getBackendName()).thenReturn("diarization-cli");

        Health health = new DiarizationHealthIndicator(service).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("available", false)
                .containsEntry("backend", "diarization-cli");
    }

    @Test
    void availableModelIsReported() {
        DiarizationService service = mock(DiarizationService.class);
        when(service.isAvailable()).thenReturn(true);
        when(service.getBackendName()).thenReturn("diarization-cli");

        Health health = new DiarizationHealthIndicator(service).health();

        assertThat(health.getDetails()).containsEntry("available", true);
    }
}
