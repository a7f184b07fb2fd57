package com.phillippitts.meetingscribe.service.process;

/**
 * Outcome of one external process run.
 *
 * @param exitCode   process exit code, or -1 when the run timed out
 * @param timedOut   true if the process was killed after exceeding its timeout
 * @param stdout     captured stdout, capped at the caller's limit
 * @param stderr     captured stderr, capped at {@link ProcessRunner#STDERR_MAX_BYTES}
 * @param durationMs wall time from start to exit or kill
 */
public record ProcessResult(int exitCode, boolean timedOut, String stdout, String stderr, long durationMs) {

    /** Characters of stderr included in error messages (roughly the first 30 lines). */
    public static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public String stderrSnippet() {
        if (stderr == null) {
            return "";
        }
        return stderr.length() <= ERROR_SNIPPET_MAX_CHARS ? stderr : stderr.substring(0, ERROR_SNIPPET_MAX_CHARS);
    }
}
