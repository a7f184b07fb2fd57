package com.phillippitts.meetingscribe.service.language;

import com.phillippitts.meetingscribe.domain.AppLanguage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stopword and script based detector for the languages in {@link AppLanguage}.
 *
 * <p>Cyrillic letters count toward Russian. Latin words are scored against small English and Spanish
 * stopword lists, and Spanish-only letters (ñ, á, ¿, ¡ ...) add to the Spanish score.
 */
@Component
public class HeuristicLanguageDetector implements LanguageDetector {

    static final int DEFAULT_MINIMUM_TEXT_LENGTH = 10;

    private static final Set<String> ENGLISH_STOPWORDS = Set.of(
            "the", "and", "is", "are", "was", "were", "you", "that", "this", "have", "with", "for",
            "not", "what", "we", "it", "of", "to", "in", "on", "be", "do", "can", "will", "i");

    private static final Set<String> SPANISH_STOPWORDS = Set.of(
            "el", "la", "los", "las", "que", "de", "y", "es", "en", "un", "una", "por", "para", "con",
            "no", "se", "del", "al", "lo", "como", "pero", "muy", "yo", "usted", "está", "hola");

    private static final String SPANISH_MARKERS = "ñáéíóúü¿¡";

    private final int minimumTextLength;

    public HeuristicLanguageDetector() {
        this(DEFAULT_MINIMUM_TEXT_LENGTH);
    }

    public HeuristicLanguageDetector(int minimumTextLength) {
        if (minimumTextLength < 0) {
            throw new IllegalArgumentException("minimumTextLength must be >= 0, got: " + minimumTextLength);
        }
        this.minimumTextLength = minimumTextLength;
    }

    @Override
    public Optional<AppLanguage> detect(String text) {
        List<LanguageScore> scores = detectWithConfidence(text);
        return scores.isEmpty() ? Optional.empty() : Optional.of(scores.get(0).language());
    }

    @Override
    public List<LanguageScore> detectWithConfidence(String text) {
        if (text == null || text.strip().length() < minimumTextLength) {
            return List.of();
        }
        Map<AppLanguage, Double> raw = score(text.toLowerCase(Locale.ROOT));
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total == 0) {
            return List.of();
        }
        List<LanguageScore> result = new ArrayList<>();
        raw.forEach((language, value) -> {
            if (value > 0) {
                result.add(new LanguageScore(language, value / total));
            }
        });
        result.sort(Comparator.comparingDouble(LanguageScore::confidence).reversed());
        return result;
    }

    private static Map<AppLanguage, Double> score(String text) {
        Map<AppLanguage, Double> scores = new EnumMap<>(AppLanguage.class);
        int cyrillic = 0;
        int letters = 0;
        int spanishMarkers = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.UnicodeBlock.of(c) == Character.UnicodeBlock.CYRILLIC) {
                cyrillic++;
            }
            if (Character.isLetter(c)) {
                letters++;
            }
            if (SPANISH_MARKERS.indexOf(c) >= 0) {
                spanishMarkers++;
            }
        }
        if (letters > 0 && cyrillic * 2 > letters) {
            scores.put(AppLanguage.RUSSIAN, 1.0);
            return scores;
        }

        double english = 0;
        double spanish = spanishMarkers;
        for (String word : text.split("[^\\p{L}]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (ENGLISH_STOPWORDS.contains(word)) {
                english++;
            }
            if (SPANISH_STOPWORDS.contains(word)) {
                spanish++;
            }
        }
        scores.put(AppLanguage.ENGLISH, english);
        scores.put(AppLanguage.SPANISH, spanish);
        return scores;
    }
}
