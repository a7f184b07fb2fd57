package com.phillippitts.meetingscribe.config;

import com.phillippitts.meetingscribe.config.properties.PipelineProperties;
import com.phillippitts.meetingscribe.config.properties.VadProperties;
import com.phillippitts.meetingscribe.service.audio.AudioFormat;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BIG_ENDIAN;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Startup sanity check for the audio format shared by the pipeline and its backends.
 * Logs the effective format and window sizes, and fails fast if the constants are inconsistent.
 */
@Configuration
class AudioFormatConfig {
    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    private final PipelineProperties pipelineProperties;
    private final VadProperties vadProperties;

    AudioFormatConfig(PipelineProperties pipelineProperties, VadProperties vadProperties) {
        this.pipelineProperties = pipelineProperties;
        this.vadProperties = vadProperties;
    }

    @PostConstruct
    void validateAudioFormat() {
        if (REQUIRED_SAMPLE_RATE != 16_000 || REQUIRED_BITS_PER_SAMPLE != 16
                || REQUIRED_CHANNELS != 1 || REQUIRED_BIG_ENDIAN) {
            throw new IllegalStateException(
                    "Audio format constants misconfigured. Expected 16kHz, 16-bit, mono, little-endian.");
        }
        LOG.info("Audio format: sampleRate={} Hz, mono float32 in memory, PCM16LE payloads", REQUIRED_SAMPLE_RATE);
        LOG.info("Speaker window: min={}s ({} samples), max={}s ({} samples); VAD threshold={} dB, hold={}s",
                pipelineProperties.getMinBufferDurationSeconds(),
                AudioFormat.samplesFor(pipelineProperties.getMinBufferDurationSeconds()),
                pipelineProperties.getMaxBufferDurationSeconds(),
                AudioFormat.samplesFor(pipelineProperties.getMaxBufferDurationSeconds()),
                vadProperties.getThresholdDb(),
                vadProperties.getHoldOpenWindowSeconds());
    }
}
