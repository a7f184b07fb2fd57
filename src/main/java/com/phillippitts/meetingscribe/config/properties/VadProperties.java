package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Voice activity gate thresholds.
 *
 * <p>{@code vad.threshold-db} is the RMS level in dBFS above which a chunk counts as speech (default: -50).
 * {@code vad.hold-open-window-seconds} keeps the gate open after the last speech chunk so trailing
 * syllables and short pauses survive (default: 0.8).
 */
@ConfigurationProperties(prefix = "vad")
@Validated
public class VadProperties {

    @DecimalMax(value = "0.0", message = "VAD threshold must be at most 0 dBFS")
    private double thresholdDb = -50.0;

    @PositiveOrZero(message = "Hold-open window must not be negative")
    private double holdOpenWindowSeconds = 0.8;

    public double getThresholdDb() {
        return thresholdDb;
    }

    public void setThresholdDb(double thresholdDb) {
        this.thresholdDb = thresholdDb;
    }

    public double getHoldOpenWindowSeconds() {
        return holdOpenWindowSeconds;
    }

    public void setHoldOpenWindowSeconds(double holdOpenWindowSeconds) {
        this.holdOpenWindowSeconds = holdOpenWindowSeconds;
    }
}
