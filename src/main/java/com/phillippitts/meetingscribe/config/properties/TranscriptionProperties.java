package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Selects the transcription backend wired into the pipeline ({@code transcription.backend=local|cloud}).
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public class TranscriptionProperties {

    public enum BackendType {
        /** whisper.cpp running on this machine. */
        LOCAL,
        /** OpenAI-compatible HTTP transcription API. */
        CLOUD
    }

    @NotNull(message = "Transcription backend must be set")
    private BackendType backend = BackendType.LOCAL;

    public BackendType getBackend() {
        return backend;
    }

    public void setBackend(BackendType backend) {
        this.backend = backend;
    }
}
