package com.production.scholar_service.service.segment;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * German/English detection from function-word ratios. Returns "de", "en" or "mixed".
 */
@Component
public class LanguageDetector {

    public static final String GERMAN = "de";
    public static final String ENGLISH = "en";
    public static final String MIXED = "mixed";

    private static final int MIN_SAMPLE_CHARS = 50;
    private static final int MAX_SAMPLE_CHARS = 5000;
    private static final double MIXED_DELTA = 0.05;
    private static final double MIXED_MIN_RATIO = 0.05;

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<String> GERMAN_WORDS = Set.of(
            "der", "die", "das", "und", "ist", "von", "für", "auf", "mit", "dem",
            "sich", "des", "ein", "nicht", "auch", "es", "bei", "wird", "sind", "einer");

    private static final Set<String> ENGLISH_WORDS = Set.of(
            "the", "and", "of", "to", "in", "is", "that", "for", "it", "as",
            "was", "with", "be", "by", "on", "not", "he", "this", "are", "from");

    public String detect(String text) {
        if (text == null || text.length() < MIN_SAMPLE_CHARS) {
            return ENGLISH;
        }
        String sample = text.substring(0, Math.min(text.length(), MAX_SAMPLE_CHARS)).toLowerCase(Locale.ROOT);

        int total = 0;
        int german = 0;
        int english = 0;
        Matcher matcher = WORD.matcher(sample);
        while (matcher.find()) {
            String word = matcher.group();
            total++;
            if (GERMAN_WORDS.contains(word)) {
                german++;
            }
            if (ENGLISH_WORDS.contains(word)) {
                english++;
            }
        }
        if (total == 0) {
            return ENGLISH;
        }

        double germanRatio = (double) german / total;
        double englishRatio = (double) english / total;
        if (Math.abs(germanRatio - englishRatio) < MIXED_DELTA
                && germanRatio > MIXED_MIN_RATIO && englishRatio > MIXED_MIN_RATIO) {
            return MIXED;
        }
        return germanRatio > englishRatio ? GERMAN : ENGLISH;
    }
}
