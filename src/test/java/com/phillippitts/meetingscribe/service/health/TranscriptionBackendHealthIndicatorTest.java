package com.phillippitts.meetingscribe.service.health;

import com.phillippitts.meetingscribe.service.stt.CloudTranscriptionBackend;
import com.phillippitts.meetingscribe.service.stt.LocalEngineTranscriptionBackend;
import com.phillippitts.meetingscribe.service.stt.SttEngine;
import com.phillippitts.meetingscribe.service.stt.cloud.SttProvider;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TranscriptionBackendHealthIndicatorTest {

    @Test
    void initializedLocalEngineIsUp() {
        SttEngine engine = mock(SttEngine.class);
        when(engine.isHealthy()).thenReturn(true);
        when(engine.getEngineName()).thenReturn("whisper");

        Health health = new TranscriptionBackendHealthIndicator(new LocalEngineTranscriptionBackend(engine)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("backend", "whisper");
    }

    @Test
    void uninitializedLocalEngineIsUnknown() {
        SttEngine engine = mock(SttEngine.class);
        when(engine.isHealthy()).thenReturn(false);
        when(engine.getEngineName()).thenReturn("whisper");

        Health health = new TranscriptionBackendHealthIndicator(new LocalEngineTranscriptionBackend(engine)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
    }

    @Test
    void unconfiguredCloudProviderIsDown() {
        SttProvider provider = mock(SttProvider.class);
        when(provider.isConfigured()).thenReturn(false);
        when(provider.getProviderName()).thenReturn("cloud");

        Health health = new TranscriptionBackendHealthIndicator(new CloudTranscriptionBackend(provider)).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("backend", "cloud");
    }
}
