package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PipelinePropertiesTest {

    private Validator validator;

    @BeforeEach
    void setup() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void defaultsMatchSlidingWindow() {
        PipelineProperties properties = new PipelineProperties();

        assertThat(properties.getMinBufferDurationSeconds()).isEqualTo(2.0);
        assertThat(properties.getMaxBufferDurationSeconds()).isEqualTo(5.0);
        assertThat(properties.getDrainPollIntervalMs()).isEqualTo(50);
        assertThat(properties.getStopDrainTimeoutMs()).isEqualTo(10_000);
        assertThat(properties.getLanguageHint()).isEmpty();
        assertThat(validator.validate(properties)).isEmpty();
    }

    @Test
    void rejectsMaxShorterThanMin() {
        PipelineProperties properties = new PipelineProperties();
        properties.setMinBufferDurationSeconds(3.0);
        properties.setMaxBufferDurationSeconds(2.0);

        Set<ConstraintViolation<PipelineProperties>> violations = validator.validate(properties);

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("must not be shorter than the minimum");
    }

    @Test
    void vadDefaults() {
        VadProperties properties = new VadProperties();

        assertThat(properties.getThresholdDb()).isEqualTo(-50.0);
        assertThat(properties.getHoldOpenWindowSeconds()).isEqualTo(0.8);
        assertThat(validator.validate(properties)).isEmpty();
    }

    @Test
    void vadRejectsPositiveThreshold() {
        VadProperties properties = new VadProperties();
        properties.setThresholdDb(3.0);

        assertThat(validator.validate(properties)).isNotEmpty();
    }
}
