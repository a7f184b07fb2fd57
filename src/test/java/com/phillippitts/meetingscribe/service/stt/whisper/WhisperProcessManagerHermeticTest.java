package com.phillippitts.meetingscribe.service.stt.whisper;

import com.phillippitts.meetingscribe.config.stt.WhisperConfig;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.service.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.meetingscribe.service.process.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessTestDoubles.TestProcess;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperProcessManagerHermeticTest {

    @TempDir
    Path tempDir;

    private final WhisperConfig cfg = new WhisperConfig("/bin/echo", "/tmp/model.bin", 2, "auto", 2, 1048576);

    @Test
    void successReturnsStdout() throws Exception {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.success("{\"transcription\":[]}"));
        WhisperProcessManager mgr = new WhisperProcessManager(factory);
        Path wav = Files.createFile(tempDir.resolve("window.wav"));

        String out = mgr.transcribe(wav, cfg, "en");

        assertThat(out).isEqualTo("{\"transcription\":[]}");
        assertThat(factory.lastCommand()).containsSubsequence("-l", "en");
    }

    @Test
    void buildsJsonModeCommandWithConfiguredLanguageWhenNoHint() {
        WhisperProcessManager mgr = new WhisperProcessManager(new StubProcessFactory(ProcessBehavior.success("")));
        Path wav = tempDir.resolve("w.wav");

        List<String> cmd = mgr.buildCommand(cfg, wav, null);

        assertThat(cmd.get(0)).isEqualTo("/bin/echo");
        assertThat(cmd).containsSubsequence("-m", "/tmp/model.bin", "-f", wav.toAbsolutePath().toString(),
                "-l", "auto", "-oj", "-of", "stdout", "-t", "2");
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() throws Exception {
        WhisperProcessManager mgr = new WhisperProcessManager(
                new StubProcessFactory(ProcessBehavior.failure(1, "something went wrong")));
        Path wav = Files.createFile(tempDir.resolve("window.wav"));

        assertThatThrownBy(() -> mgr.transcribe(wav, cfg, null))
            .isInstanceOf(TranscriptionException.class)
            .hasMessageContaining("Non-zero exit: 1")
            .hasMessageContaining("stderr=something went wrong")
            .hasMessageContaining("backend: whisper");
    }

    @Test
    void timeoutKillsProcessAndThrows() throws Exception {
        TestProcess tp = new TestProcess(ProcessBehavior.hanging());
        WhisperProcessManager mgr = new WhisperProcessManager(new StubProcessFactory(tp));
        WhisperConfig shortTimeout = new WhisperConfig("/bin/echo", "/tmp/model.bin", 1, "en", 2, 1048576);
        Path wav = Files.createFile(tempDir.resolve("window.wav"));

        long start = System.nanoTime();
        assertThatThrownBy(() -> mgr.transcribe(wav, shortTimeout, null))
            .isInstanceOf(TranscriptionException.class)
            .hasMessageContaining("Timeout after 1s");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        assertThat(durationMs).isLessThan(5000);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(tp::wasDestroyCalled);
    }
}
