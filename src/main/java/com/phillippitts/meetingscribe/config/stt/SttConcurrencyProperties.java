package com.phillippitts.meetingscribe.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

/**
 * Caps on parallel backend calls ({@code stt.concurrency.*}). With two speakers at most two windows
 * are in flight, so the defaults only bite when several sessions share one process.
 *
 * @param whisperMax       parallel whisper.cpp processes
 * @param cloudMax         parallel cloud requests
 * @param acquireTimeoutMs wait for a free slot before the window fails
 */
@ConfigurationProperties(prefix = "stt.concurrency")
@Validated
public record SttConcurrencyProperties(
        @Positive(message = "Whisper max concurrency must be positive") int whisperMax,
        @Positive(message = "Cloud max concurrency must be positive") int cloudMax,
        @Positive(message = "Acquire timeout must be positive") int acquireTimeoutMs
) {
    public SttConcurrencyProperties {
        whisperMax = whisperMax == 0 ? 2 : whisperMax;
        cloudMax = cloudMax == 0 ? 4 : cloudMax;
        acquireTimeoutMs = acquireTimeoutMs == 0 ? 1000 : acquireTimeoutMs;
    }

    public static SttConcurrencyProperties defaults() {
        return new SttConcurrencyProperties(0, 0, 0);
    }
}
