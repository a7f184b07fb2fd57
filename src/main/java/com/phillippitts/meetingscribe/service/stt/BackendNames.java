package com.phillippitts.meetingscribe.service.stt;

/**
 * Backend identifiers used in logs, metric tags, health details and exceptions.
 */
public final class BackendNames {

    /** whisper.cpp run as a local process. */
    public static final String WHISPER = "whisper";

    /** OpenAI-compatible HTTP transcription API. */
    public static final String CLOUD = "cloud";

    /** Command-line diarization tool. */
    public static final String DIARIZATION_CLI = "diarization-cli";

    private BackendNames() {
    }
}
