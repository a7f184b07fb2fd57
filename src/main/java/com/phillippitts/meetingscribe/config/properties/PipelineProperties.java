package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sliding-window settings for the per-speaker dispatcher.
 *
 * <p>Properties:
 * <ul>
 *   <li>pipeline.min-buffer-duration-seconds - window length that triggers a transcription (default: 2.0)</li>
 *   <li>pipeline.max-buffer-duration-seconds - backlog cap while a transcription is in flight (default: 5.0)</li>
 *   <li>pipeline.drain-poll-interval-ms - poll period while waiting for in-flight work (default: 50)</li>
 *   <li>pipeline.stop-drain-timeout-ms - upper bound on the in-flight wait during stop (default: 10000)</li>
 *   <li>pipeline.language-hint - ISO 639-1 code passed to local backends; blank means auto-detect</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    @DecimalMin(value = "0.1", message = "Minimum buffer duration must be at least 0.1 s")
    private double minBufferDurationSeconds = 2.0;

    @DecimalMin(value = "0.1", message = "Maximum buffer duration must be at least 0.1 s")
    private double maxBufferDurationSeconds = 5.0;

    @Positive(message = "Drain poll interval must be positive")
    private long drainPollIntervalMs = 50;

    @Positive(message = "Stop drain timeout must be positive")
    private long stopDrainTimeoutMs = 10_000;

    private String languageHint = "";

    @AssertTrue(message = "Maximum buffer duration must not be shorter than the minimum")
    public boolean isWindowOrdered() {
        return maxBufferDurationSeconds >= minBufferDurationSeconds;
    }

    public double getMinBufferDurationSeconds() {
        return minBufferDurationSeconds;
    }

    public void setMinBufferDurationSeconds(double minBufferDurationSeconds) {
        this.minBufferDurationSeconds = minBufferDurationSeconds;
    }

    public double getMaxBufferDurationSeconds() {
        return maxBufferDurationSeconds;
    }

    public void setMaxBufferDurationSeconds(double maxBufferDurationSeconds) {
        this.maxBufferDurationSeconds = maxBufferDurationSeconds;
    }

    public long getDrainPollIntervalMs() {
        return drainPollIntervalMs;
    }

    public void setDrainPollIntervalMs(long drainPollIntervalMs) {
        this.drainPollIntervalMs = drainPollIntervalMs;
    }

    public long getStopDrainTimeoutMs() {
        return stopDrainTimeoutMs;
    }

    public void setStopDrainTimeoutMs(long stopDrainTimeoutMs) {
        this.stopDrainTimeoutMs = stopDrainTimeoutMs;
    }

    public String getLanguageHint() {
        return languageHint;
    }

    public void setLanguageHint(String languageHint) {
        this.languageHint = languageHint;
    }
}
