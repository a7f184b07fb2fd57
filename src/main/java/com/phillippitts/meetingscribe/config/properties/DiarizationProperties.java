package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Offline diarization command-line backend.
 *
 * <p>The binary is invoked as {@code <binary-path> --model <model-path> --input <wav> --format json}
 * and must print {@code {"segments":[{"start":..,"end":..,"speaker":".."}]}} on stdout.
 */
@ConfigurationProperties(prefix = "diarization")
@Validated
public class DiarizationProperties {

    @NotBlank(message = "Diarization binary path must not be blank")
    private String binaryPath = "tools/diarize/diarize";

    @NotBlank(message = "Diarization model path must not be blank")
    private String modelPath = "models/diarization";

    @Positive(message = "Diarization timeout must be positive")
    private int timeoutSeconds = 120;

    @Positive(message = "Max stdout bytes must be positive")
    private int maxStdoutBytes = 4 * 1024 * 1024;

    public String getBinaryPath() {
        return binaryPath;
    }

    public void setBinaryPath(String binaryPath) {
        this.binaryPath = binaryPath;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }
}
