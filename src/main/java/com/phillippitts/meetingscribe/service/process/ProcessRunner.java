package com.phillippitts.meetingscribe.service.process;

import com.phillippitts.meetingscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command to completion with a timeout and bounded output capture.
 *
 * <p>Both pipes are drained on daemon threads from the moment the process starts, so a process that
 * writes more than the pipe buffer never stalls. Output past the cap is read and thrown away. A run
 * that exceeds its timeout is destroyed, forcibly if it ignores the first request.
 *
 * <p>Holds no per-run state; whisper.cpp and the diarization CLI each share one runner across threads.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    public static final int STDERR_MAX_BYTES = 256 * 1024;

    static final Duration DRAIN_TIMEOUT = Duration.ofMillis(500);
    static final Duration DESTROY_GRACE = Duration.ofMillis(500);
    static final Duration DESTROY_FORCE_WAIT = Duration.ofMillis(1000);

    private final ProcessFactory processFactory;
    private final String name;

    /**
     * @param name used in capture thread names and log lines, e.g. "whisper"
     */
    public ProcessRunner(ProcessFactory processFactory, String name) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if the caller is interrupted while waiting; the process is destroyed first
     */
    public ProcessResult run(List<String> command, Path workingDir, Duration timeout, int maxStdoutBytes)
            throws IOException, InterruptedException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");

        long startTime = System.nanoTime();
        Process process = processFactory.start(command, workingDir);
        CappedCapture stdout = CappedCapture.start(process.getInputStream(), name + "-stdout", maxStdoutBytes);
        CappedCapture stderr = CappedCapture.start(process.getErrorStream(), name + "-stderr", STDERR_MAX_BYTES);

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            destroy(process);
            throw e;
        }
        if (!finished) {
            destroy(process);
            stderr.await(DRAIN_TIMEOUT);
            LOG.debug("{} killed after {} ms", name, TimeUtils.elapsedMillis(startTime));
            return new ProcessResult(-1, true, stdout.text(), stderr.text(), TimeUtils.elapsedMillis(startTime));
        }

        stdout.await(DRAIN_TIMEOUT);
        stderr.await(DRAIN_TIMEOUT);
        int exitCode = process.exitValue();
        String out = stdout.text();
        LOG.debug("{} exited with {} ({} stdout chars, {} ms)",
                name, exitCode, out.length(), TimeUtils.elapsedMillis(startTime));
        return new ProcessResult(exitCode, false, out, stderr.text(), TimeUtils.elapsedMillis(startTime));
    }

    private void destroy(Process process) throws InterruptedException {
        process.destroy();
        if (process.waitFor(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
            return;
        }
        process.destroyForcibly();
        if (!process.waitFor(DESTROY_FORCE_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
            LOG.warn("{} process still alive after destroyForcibly", name);
        }
    }

    /**
     * Resolves a configured path against the JVM working directory.
     */
    public static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        return path.isAbsolute() ? path : Path.of("").toAbsolutePath().resolve(path).normalize();
    }

    /**
     * Drains one pipe into a byte buffer of at most {@code limit} bytes.
     */
    private static final class CappedCapture implements Runnable {
        private final InputStream in;
        private final String label;
        private final int limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread thread;

        private CappedCapture(InputStream in, String label, int limit) {
            this.in = in;
            this.label = label;
            this.limit = Math.max(0, limit);
            this.thread = new Thread(this, label);
            this.thread.setDaemon(true);
        }

        static CappedCapture start(InputStream in, String label, int limit) {
            CappedCapture capture = new CappedCapture(in, label, limit);
            capture.thread.start();
            return capture;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            boolean overflowLogged = false;
            try (InputStream stream = in) {
                int read;
                while ((read = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        int room = limit - buffer.size();
                        buffer.write(chunk, 0, Math.max(0, Math.min(room, read)));
                        if (read > room && !overflowLogged) {
                            LOG.warn("Output of '{}' exceeded {} bytes; discarding the rest", label, limit);
                            overflowLogged = true;
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Capture '{}' stopped: {}", label, e.toString());
            }
        }

        void await(Duration timeout) throws InterruptedException {
            thread.join(timeout.toMillis());
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8).stripTrailing();
            }
        }
    }
}
