package com.phillippitts.meetingscribe.service.stt.whisper;

import com.phillippitts.meetingscribe.config.stt.WhisperConfig;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.meetingscribe.service.process.DefaultProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessResult;
import com.phillippitts.meetingscribe.service.process.ProcessRunner;
import com.phillippitts.meetingscribe.service.stt.BackendNames;
import com.phillippitts.meetingscribe.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the whisper.cpp binary on a WAV file and returns its JSON stdout.
 *
 * <p>Responsibilities:
 * - Build a deterministic CLI from {@link WhisperConfig} and the per-call language
 * - Run it through {@link ProcessRunner} (timeout, capped stdout/stderr capture)
 * - Turn timeouts, non-zero exits and I/O errors into {@link TranscriptionException} with context
 *
 * <p>Each call owns its process, so concurrent calls for different speakers do not interfere.
 * Temp-file WAV handling is performed by the caller (engine).
 */
@Component
public class WhisperProcessManager {

    private final ProcessRunner runner;

    public WhisperProcessManager() {
        this(new DefaultProcessFactory());
    }

    WhisperProcessManager(ProcessFactory processFactory) {
        this.runner = new ProcessRunner(Objects.requireNonNull(processFactory, "processFactory"),
                BackendNames.WHISPER);
    }

    /**
     * Executes whisper.cpp for the given WAV file.
     *
     * <p>CLI contract:
     *   <pre>
     *   ${binary} -m ${model} -f ${wav} -l ${language} -oj -of stdout -t ${threads}
     *   </pre>
     *
     * @param wavPath  path to WAV file (created by caller)
     * @param cfg      whisper configuration
     * @param language ISO 639-1 code or "auto"
     * @return JSON stdout produced by whisper (may be empty)
     * @throws TranscriptionException on timeout, non-zero exit, or I/O error
     */
    public String transcribe(Path wavPath, WhisperConfig cfg, String language) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(cfg, wavPath, language);
        long startTime = System.nanoTime();
        ProcessResult result;
        try {
            result = runner.run(command, wavPath.getParent(),
                    Duration.ofSeconds(cfg.timeoutSeconds()), cfg.maxStdoutBytes());
        } catch (IOException e) {
            throw whisperError("I/O failure: " + e.getMessage(), cfg, -1,
                    TimeUtils.elapsedMillis(startTime), "", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw whisperError("Interrupted while waiting for whisper.cpp", cfg, -1,
                    TimeUtils.elapsedMillis(startTime), "", e);
        }

        if (result.timedOut()) {
            throw whisperError("Timeout after " + cfg.timeoutSeconds() + "s", cfg, -1,
                    result.durationMs(), result.stderrSnippet(), null);
        }
        if (result.exitCode() != 0) {
            throw whisperError("Non-zero exit: " + result.exitCode(), cfg, result.exitCode(),
                    result.durationMs(), result.stderrSnippet(), null);
        }
        return result.stdout();
    }

    List<String> buildCommand(WhisperConfig cfg, Path wavPath, String language) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ProcessRunner.resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(ProcessRunner.resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(language == null || language.isBlank() ? cfg.language() : language);
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    private static TranscriptionException whisperError(String msg, WhisperConfig cfg, int exitCode,
                                                       long durationMs, String stderrSnippet, Throwable cause) {
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .backend(BackendNames.WHISPER)
                .exitCode(exitCode)
                .durationMs(durationMs)
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("modelPath", cfg.modelPath())
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
