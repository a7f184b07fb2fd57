package com.phillippitts.meetingscribe.domain;

/**
 * Origin of a captured audio stream. Each source maps to a fixed speaker label.
 */
public enum AudioSource {
    MICROPHONE("You"),
    SYSTEM_AUDIO("Others");

    private final String speakerLabel;

    AudioSource(String speakerLabel) {
        this.speakerLabel = speakerLabel;
    }

    public String speakerLabel() {
        return speakerLabel;
    }
}
