package com.phillippitts.meetingscribe.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts real OS processes. Stdin is closed right after start since neither whisper.cpp nor the
 * diarization CLI read from it; stdout and stderr stay separate pipes for {@link ProcessRunner}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        Process process = builder.start();
        process.getOutputStream().close();
        return process;
    }
}
