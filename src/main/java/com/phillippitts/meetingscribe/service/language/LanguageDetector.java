package com.phillippitts.meetingscribe.service.language;

import com.phillippitts.meetingscribe.domain.AppLanguage;

import java.util.List;
import java.util.Optional;

/**
 * Guesses the language of a transcribed segment.
 */
public interface LanguageDetector {

    /**
     * @return the dominant language, or empty when the text is too short or unrecognized
     */
    Optional<AppLanguage> detect(String text);

    /**
     * Scores every recognized language, highest first. Scores are in {@code [0, 1]} and sum to at most 1.
     */
    List<LanguageScore> detectWithConfidence(String text);

    record LanguageScore(AppLanguage language, double confidence) {
    }
}
