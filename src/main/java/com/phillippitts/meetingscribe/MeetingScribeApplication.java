package com.phillippitts.meetingscribe;

import com.phillippitts.meetingscribe.config.properties.DiarizationProperties;
import com.phillippitts.meetingscribe.config.properties.PipelineProperties;
import com.phillippitts.meetingscribe.config.properties.TranscriptionProperties;
import com.phillippitts.meetingscribe.config.properties.VadProperties;
import com.phillippitts.meetingscribe.config.stt.CloudSttProperties;
import com.phillippitts.meetingscribe.config.stt.SttConcurrencyProperties;
import com.phillippitts.meetingscribe.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        SttConcurrencyProperties.class,
        CloudSttProperties.class,
        PipelineProperties.class,
        VadProperties.class,
        TranscriptionProperties.class,
        DiarizationProperties.class
})
@EnableScheduling
public class MeetingScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingScribeApplication.class, args);
    }

}
