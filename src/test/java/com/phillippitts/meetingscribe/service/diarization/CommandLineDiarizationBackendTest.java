package com.phillippitts.meetingscribe.service.diarization;

import com.phillippitts.meetingscribe.config.properties.DiarizationProperties;
import com.phillippitts.meetingscribe.domain.SpeakerSegment;
import com.phillippitts.meetingscribe.exception.DiarizationException;
import com.phillippitts.meetingscribe.service.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.meetingscribe.service.process.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineDiarizationBackendTest {

    @TempDir
    Path tempDir;

    private DiarizationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DiarizationProperties();
        properties.setBinaryPath(tempDir.resolve("diarize").toString());
        properties.setModelPath(tempDir.resolve("model").toString());
        properties.setTimeoutSeconds(1);
    }

    @Test
    void parsesSegmentsFromCommandOutput() {
        String json = """
            {"segments": [
              {"start": 0.0, "end": 1.5, "speaker": "SPEAKER_00"},
              {"start": 1.5, "end": 3.0, "speaker": 1}
            ]}
            """;
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.success(json));
        CommandLineDiarizationBackend backend = new CommandLineDiarizationBackend(properties, factory);

        List<SpeakerSegment> segments = backend.process(new float[48_000], 16_000);

        assertThat(segments).containsExactly(
                new SpeakerSegment("SPEAKER_00", 0.0, 1.5),
                new SpeakerSegment("1", 1.5, 3.0));
        assertThat(factory.lastCommand()).containsSubsequence("--model", "--input", "--format", "json");
    }

    @Test
    void tempWavIsRemovedAfterRun() {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.success(""));
        CommandLineDiarizationBackend backend = new CommandLineDiarizationBackend(properties, factory);

        backend.process(new float[1_600], 16_000);

        List<String> cmd = factory.lastCommand();
        Path wav = Path.of(cmd.get(cmd.indexOf("--input") + 1));
        assertThat(wav).doesNotExist();
    }

    @Test
    void nonZeroExitThrows() {
        CommandLineDiarizationBackend backend = new CommandLineDiarizationBackend(properties,
                new StubProcessFactory(ProcessBehavior.failure(2, "no speakers model")));

        assertThatThrownBy(() -> backend.process(new float[1_600], 16_000))
                .isInstanceOf(DiarizationException.class)
                .hasMessageContaining("Non-zero exit: 2")
                .hasMessageContaining("no speakers model");
    }

    @Test
    void timeoutDestroysProcessAndThrows() {
        TestProcess process = new TestProcess(ProcessBehavior.hanging());
        CommandLineDiarizationBackend backend = new CommandLineDiarizationBackend(properties,
                new StubProcessFactory(process));

        assertThatThrownBy(() -> backend.process(new float[1_600], 16_000))
                .isInstanceOf(DiarizationException.class)
                .hasMessageContaining("Timeout after 1s");
        assertThat(process.wasDestroyCalled()).isTrue();
    }

    @Test
    void malformedOutputThrows() {
        assertThatThrownBy(() -> CommandLineDiarizationBackend.parseSegments("{\"segments\": [{\"start\": 0}]}"))
                .isInstanceOf(DiarizationException.class)
                .hasMessageContaining("Malformed diarization output");
        assertThatThrownBy(() -> CommandLineDiarizationBackend.parseSegments(
                "{\"segments\": [{\"start\": 2.0, \"end\": 1.0, \"speaker\": \"A\"}]}"))
                .isInstanceOf(DiarizationException.class);
    }

    @Test
    void blankOutputMeansNoSegments() {
        assertThat(CommandLineDiarizationBackend.parseSegments("  ")).isEmpty();
        assertThat(CommandLineDiarizationBackend.parseSegments("{}")).isEmpty();
    }

    @Test
    void modelAvailabilityNeedsExecutableBinaryAndModel() throws Exception {
        CommandLineDiarizationBackend backend = new CommandLineDiarizationBackend(properties,
                new StubProcessFactory(ProcessBehavior.success("")));
        assertThat(backend.isModelAvailable()).isFalse();

        Path binary = Files.createFile(tempDir.resolve("diarize"));
        binary.toFile().setExecutable(true);
        Files.createDirectory(tempDir.resolve("model"));

        assertThat(backend.isModelAvailable()).isTrue();
    }
}
