package com.production.scholar_service.service.segment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes extracted page text before metadata heuristics and segmentation.
 * Paragraph breaks (blank lines) survive cleaning; the segmenter relies on them.
 */
@Service
@Slf4j
public class TextCleaningService {

    // Running headers/footers: page numbers, copyright and license lines, journal boilerplate
    private static final Pattern HEADER_FOOTER_PATTERN = Pattern.compile(
            "(?m)^\\s*(Page\\s*\\d+(\\s*of\\s*\\d+)?|Seite\\s*\\d+(\\s*von\\s*\\d+)?|\\d+\\s*(of|von)\\s*\\d+|\\d{1,4}"
                    + "|All rights reserved.*|Alle Rechte vorbehalten.*|Downloaded from .*)\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t\\u00A0]+");

    private static final Pattern MULTIPLE_NEWLINES = Pattern.compile("\\n{3,}");

    // Control characters except newline and tab
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    // Words hyphenated across a line break: "recog-\nnition" -> "recognition"
    private static final Pattern LINE_HYPHENATION = Pattern.compile("(\\p{L})-[ \\t]*\\n[ \\t]*(\\p{Ll})");

    public String cleanText(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }

        String text = dropLoneSurrogates(rawText);

        // NFKC resolves PDF ligatures such as "ﬁ"
        text = Normalizer.normalize(text, Normalizer.Form.NFKC);
        text = CONTROL_CHARS.matcher(text).replaceAll(" ");
        text = text.replace("\r\n", "\n").replace("\r", "\n");
        text = HEADER_FOOTER_PATTERN.matcher(text).replaceAll("");
        text = MULTIPLE_SPACES.matcher(text).replaceAll(" ");
        text = trimLines(text);
        text = MULTIPLE_NEWLINES.matcher(text).replaceAll("\n\n");
        text = text.trim();

        log.debug("Cleaned text: {} chars -> {} chars", rawText.length(), text.length());
        return text;
    }

    public String removeHyphenation(String text) {
        text = text.replace("\u00AD", "");
        return LINE_HYPHENATION.matcher(text).replaceAll("$1$2");
    }

    public String normalizeQuotes(String text) {
        return text
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\u201A', '\'')
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u201E', '"')
                .replace('\u00AB', '"')
                .replace('\u00BB', '"')
                .replace('\u2013', '-')
                .replace('\u2014', '-');
    }

    public String fullClean(String rawText) {
        String text = cleanText(rawText);
        text = removeHyphenation(text);
        text = normalizeQuotes(text);
        return text;
    }

    private String trimLines(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            result.append(lines[i].trim());
            if (i < lines.length - 1) {
                result.append('\n');
            }
        }
        return result.toString();
    }

    private String dropLoneSurrogates(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            boolean paired = Character.isHighSurrogate(ch) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1));
            if (paired) {
                if (sb != null) {
                    sb.append(ch).append(text.charAt(i + 1));
                }
                i++;
                continue;
            }
            if (Character.isSurrogate(ch)) {
                if (sb == null) {
                    sb = new StringBuilder(text.length()).append(text, 0, i);
                }
                continue;
            }
            if (sb != null) {
                sb.append(ch);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
