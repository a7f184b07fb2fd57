package com.phillippitts.meetingscribe.config.stt;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WhisperConfigTest {

    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    private static String singleViolation(WhisperConfig config) {
        Set<ConstraintViolation<WhisperConfig>> violations = validator.validate(config);
        assertThat(violations).hasSize(1);
        return violations.iterator().next().getMessage();
    }

    @Test
    void defaultsMatchShippedProperties() {
        WhisperConfig config = WhisperConfig.defaults();

        assertThat(config).isEqualTo(new WhisperConfig("tools/whisper.cpp/main", "models/ggml-base.bin",
                10, "auto", 4, 1_048_576));
        assertThat(validator.validate(config)).isEmpty();
    }

    @Test
    void unsetFieldsFallBackIndividually() {
        WhisperConfig config = new WhisperConfig("/opt/whisper/main", null, 0, "ru", 0, 0);

        assertThat(config.binaryPath()).isEqualTo("/opt/whisper/main");
        assertThat(config.modelPath()).isEqualTo(WhisperConfig.DEFAULT_MODEL_PATH);
        assertThat(config.timeoutSeconds()).isEqualTo(WhisperConfig.DEFAULT_TIMEOUT_SECONDS);
        assertThat(config.language()).isEqualTo("ru");
        assertThat(config.threads()).isEqualTo(WhisperConfig.DEFAULT_THREADS);
        assertThat(config.maxStdoutBytes()).isEqualTo(WhisperConfig.DEFAULT_MAX_STDOUT_BYTES);
    }

    @Test
    void blankPathsAreRejected() {
        assertThat(singleViolation(new WhisperConfig(" ", "m.bin", 10, "en", 4, 1024)))
                .contains("binary path must not be blank");
        assertThat(singleViolation(new WhisperConfig("main", "", 10, "en", 4, 1024)))
                .contains("model path must not be blank");
    }

    @Test
    void negativeLimitsAreRejected() {
        assertThat(singleViolation(new WhisperConfig("main", "m.bin", -1, "en", 4, 1024)))
                .contains("Timeout must be positive");
        assertThat(singleViolation(new WhisperConfig("main", "m.bin", 10, "en", -2, 1024)))
                .contains("Thread count must be positive");
    }

    @Test
    void blankLanguageIsRejected() {
        assertThat(singleViolation(new WhisperConfig("main", "m.bin", 10, "  ", 4, 1024)))
                .contains("Language code must not be blank");
    }
}
