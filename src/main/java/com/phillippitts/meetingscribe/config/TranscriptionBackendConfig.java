package com.phillippitts.meetingscribe.config;

import com.phillippitts.meetingscribe.config.properties.TranscriptionProperties;
import com.phillippitts.meetingscribe.service.stt.CloudTranscriptionBackend;
import com.phillippitts.meetingscribe.service.stt.LocalEngineTranscriptionBackend;
import com.phillippitts.meetingscribe.service.stt.TranscriptionBackend;
import com.phillippitts.meetingscribe.service.stt.cloud.SttProvider;
import com.phillippitts.meetingscribe.service.stt.whisper.WhisperSttEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the one {@link TranscriptionBackend} the pipeline uses, chosen by {@code transcription.backend}.
 * The choice is made once at startup.
 */
@Configuration
public class TranscriptionBackendConfig {

    private static final Logger LOG = LogManager.getLogger(TranscriptionBackendConfig.class);

    @Bean
    public TranscriptionBackend transcriptionBackend(TranscriptionProperties properties,
                                                     ObjectProvider<WhisperSttEngine> whisperEngine,
                                                     ObjectProvider<SttProvider> cloudProvider) {
        TranscriptionBackend backend = switch (properties.getBackend()) {
            case LOCAL -> new LocalEngineTranscriptionBackend(whisperEngine.getObject());
            case CLOUD -> new CloudTranscriptionBackend(cloudProvider.getObject());
        };
        LOG.info("Transcription backend selected: {} ({})", properties.getBackend(), backend.getBackendName());
        return backend;
    }
}
