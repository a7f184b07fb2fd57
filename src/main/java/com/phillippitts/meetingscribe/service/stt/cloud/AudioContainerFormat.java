package com.phillippitts.meetingscribe.service.stt.cloud;

/**
 * Container formats a remote provider can accept. The pipeline only produces {@link #WAV}.
 */
public enum AudioContainerFormat {
    WAV("wav", "audio/wav"),
    MP3("mp3", "audio/mpeg"),
    M4A("m4a", "audio/mp4"),
    WEBM("webm", "audio/webm");

    private final String fileExtension;
    private final String mimeType;

    AudioContainerFormat(String fileExtension, String mimeType) {
        this.fileExtension = fileExtension;
        this.mimeType = mimeType;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public String mimeType() {
        return mimeType;
    }
}
