package com.phillippitts.meetingscribe.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the local whisper.cpp backend.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.model-path=models/ggml-base.bin
 * stt.whisper.timeout-seconds=10
 * stt.whisper.language=auto
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * <p>Unset values fall back to the defaults above. Use a multilingual model (not {@code *.en.bin})
 * when speakers switch between languages.
 *
 * @param binaryPath     path to the whisper.cpp binary
 * @param modelPath      path to the GGML model file (.bin)
 * @param timeoutSeconds maximum time for one speaker window
 * @param language       default language code; "auto" lets whisper detect it per window
 * @param threads        CPU threads per whisper.cpp process
 * @param maxStdoutBytes cap on captured JSON output
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
    public static final String DEFAULT_BINARY_PATH = "tools/whisper.cpp/main";
    public static final String DEFAULT_MODEL_PATH = "models/ggml-base.bin";
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;
    public static final String DEFAULT_LANGUAGE = "auto";
    public static final int DEFAULT_THREADS = 4;
    public static final int DEFAULT_MAX_STDOUT_BYTES = 1_048_576;

    public WhisperConfig {
        binaryPath = binaryPath == null ? DEFAULT_BINARY_PATH : binaryPath;
        modelPath = modelPath == null ? DEFAULT_MODEL_PATH : modelPath;
        timeoutSeconds = timeoutSeconds == 0 ? DEFAULT_TIMEOUT_SECONDS : timeoutSeconds;
        language = language == null ? DEFAULT_LANGUAGE : language;
        threads = threads == 0 ? DEFAULT_THREADS : threads;
        maxStdoutBytes = maxStdoutBytes == 0 ? DEFAULT_MAX_STDOUT_BYTES : maxStdoutBytes;
    }

    public static WhisperConfig defaults() {
        return new WhisperConfig(null, null, 0, null, 0, 0);
    }
}
