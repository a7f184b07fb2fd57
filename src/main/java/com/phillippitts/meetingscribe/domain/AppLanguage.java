package com.phillippitts.meetingscribe.domain;

import java.util.Optional;

/**
 * Languages the pipeline can tag on emitted segments.
 */
public enum AppLanguage {
    AUTO("auto", "Auto-detect"),
    ENGLISH("en", "English"),
    RUSSIAN("ru", "Russian"),
    SPANISH("es", "Spanish");

    private final String isoCode;
    private final String displayName;

    AppLanguage(String isoCode, String displayName) {
        this.isoCode = isoCode;
        this.displayName = displayName;
    }

    public String isoCode() {
        return isoCode;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Looks up a concrete language by ISO 639-1 code. {@code auto} is not a concrete language.
     */
    public static Optional<AppLanguage> fromIsoCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        for (AppLanguage language : values()) {
            if (language != AUTO && language.isoCode.equalsIgnoreCase(code.trim())) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
