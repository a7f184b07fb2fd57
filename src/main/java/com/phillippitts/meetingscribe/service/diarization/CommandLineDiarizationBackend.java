package com.phillippitts.meetingscribe.service.diarization;

import com.phillippitts.meetingscribe.config.properties.DiarizationProperties;
import com.phillippitts.meetingscribe.domain.SpeakerSegment;
import com.phillippitts.meetingscribe.exception.DiarizationException;
import com.phillippitts.meetingscribe.service.audio.AudioFormat;
import com.phillippitts.meetingscribe.service.audio.PcmConverter;
import com.phillippitts.meetingscribe.service.audio.WavEncoder;
import com.phillippitts.meetingscribe.service.process.DefaultProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessFactory;
import com.phillippitts.meetingscribe.service.process.ProcessResult;
import com.phillippitts.meetingscribe.service.process.ProcessRunner;
import com.phillippitts.meetingscribe.service.stt.BackendNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link DiarizationBackend} that runs an external diarization command on a temporary WAV file.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} --model ${model} --input ${wav} --format json
 * </pre>
 * stdout: {@code {"segments":[{"start":0.0,"end":1.5,"speaker":"SPEAKER_00"}, ...]}} with times in
 * seconds. Audio at other rates is resampled to 16 kHz first, so times are in the caller's timeline.
 */
@Component
public class CommandLineDiarizationBackend implements DiarizationBackend {

    private static final Logger LOG = LogManager.getLogger(CommandLineDiarizationBackend.class);

    private final DiarizationProperties properties;
    private final ProcessRunner runner;

    @Autowired
    public CommandLineDiarizationBackend(DiarizationProperties properties) {
        this(properties, new DefaultProcessFactory());
    }

    CommandLineDiarizationBackend(DiarizationProperties properties, ProcessFactory processFactory) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.runner = new ProcessRunner(Objects.requireNonNull(processFactory, "processFactory"),
                BackendNames.DIARIZATION_CLI);
    }

    @Override
    public List<SpeakerSegment> process(float[] samples, int sampleRate) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        float[] resampled = PcmConverter.resample(samples, sampleRate, AudioFormat.REQUIRED_SAMPLE_RATE);
        Path wav = null;
        try {
            wav = Files.createTempFile("diarize-", ".wav");
            WavEncoder.write(resampled, wav);
            ProcessResult result = runner.run(buildCommand(wav), wav.getParent(),
                    Duration.ofSeconds(properties.getTimeoutSeconds()), properties.getMaxStdoutBytes());
            if (result.timedOut()) {
                throw new DiarizationException("Timeout after " + properties.getTimeoutSeconds() + "s",
                        getBackendName());
            }
            if (!result.succeeded()) {
                throw new DiarizationException("Non-zero exit: " + result.exitCode() + ", stderr: "
                        + result.stderrSnippet(), getBackendName());
            }
            List<SpeakerSegment> segments = parseSegments(result.stdout());
            LOG.debug("Diarized {}s of audio in {} ms ({} segments)",
                    AudioFormat.durationSeconds(resampled.length), result.durationMs(), segments.size());
            return segments;
        } catch (IOException e) {
            throw new DiarizationException("I/O failure: " + e.getMessage(), getBackendName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiarizationException("Interrupted while waiting for diarization", getBackendName(), e);
        } finally {
            deleteQuietly(wav);
        }
    }

    List<String> buildCommand(Path wav) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ProcessRunner.resolvePath(properties.getBinaryPath()).toString());
        cmd.add("--model");
        cmd.add(ProcessRunner.resolvePath(properties.getModelPath()).toString());
        cmd.add("--input");
        cmd.add(wav.toAbsolutePath().toString());
        cmd.add("--format");
        cmd.add("json");
        return cmd;
    }

    /**
     * Parses {@code segments[].{start,end,speaker}}. Blank output means no speech was found.
     */
    static List<SpeakerSegment> parseSegments(String json) {
        List<SpeakerSegment> segments = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return segments;
        }
        try {
            JSONArray array = new JSONObject(json).optJSONArray("segments");
            if (array == null) {
                return segments;
            }
            for (int i = 0; i < array.length(); i++) {
                JSONObject seg = array.getJSONObject(i);
                segments.add(new SpeakerSegment(
                        String.valueOf(seg.get("speaker")),
                        seg.getDouble("start"),
                        seg.getDouble("end")));
            }
            return segments;
        } catch (JSONException | IllegalArgumentException e) {
            throw new DiarizationException("Malformed diarization output: " + e.getMessage(),
                    BackendNames.DIARIZATION_CLI, e);
        }
    }

    @Override
    public boolean isModelAvailable() {
        return Files.isExecutable(ProcessRunner.resolvePath(properties.getBinaryPath()))
                && Files.exists(ProcessRunner.resolvePath(properties.getModelPath()));
    }

    @Override
    public String getBackendName() {
        return BackendNames.DIARIZATION_CLI;
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp WAV {}: {}", wav, e.toString());
        }
    }
}
