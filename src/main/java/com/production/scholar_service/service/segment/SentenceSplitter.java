package com.production.scholar_service.service.segment;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into sentences with their character offsets.
 * A boundary is never placed inside an entity span or after a known abbreviation or initial.
 */
@Component
public class SentenceSplitter {

    private static final Pattern BOUNDARY = Pattern.compile("[.!?]+[\"')\\]]*(?=\\s)|\\n\\s*\\n");

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "e.g", "i.e", "al", "etc", "vs", "cf", "fig", "figs", "eq", "eqs", "tab", "no", "nos", "vol",
            "pp", "p", "ch", "sec", "ed", "eds", "dr", "prof", "mr", "mrs", "ms", "st", "approx", "resp",
            "z.b", "bzw", "ca", "vgl", "nr", "s", "abb", "bd", "hrsg", "usw", "d.h", "u.a", "jh", "inkl");

    public record Sentence(int start, int end, boolean endsParagraph) {
    }

    public List<Sentence> split(String text, List<EntitySpan> entities) {
        List<Sentence> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }

        int sentenceStart = skipWhitespace(text, 0);
        Matcher matcher = BOUNDARY.matcher(text);
        while (matcher.find()) {
            int boundary = matcher.end();
            boolean paragraph = PARAGRAPH_BREAK.matcher(matcher.group()).matches();
            if (paragraph) {
                boundary = matcher.start();
            }
            if (boundary <= sentenceStart) {
                continue;
            }
            if (!paragraph && (insideEntity(boundary, entities) || isAbbreviation(text, matcher.start()))) {
                continue;
            }
            int end = trimEnd(text, sentenceStart, boundary);
            if (end > sentenceStart) {
                boolean endsParagraph = paragraph || startsParagraph(text, boundary);
                sentences.add(new Sentence(sentenceStart, end, endsParagraph));
            }
            sentenceStart = skipWhitespace(text, paragraph ? matcher.end() : boundary);
        }

        int end = trimEnd(text, sentenceStart, text.length());
        if (end > sentenceStart) {
            sentences.add(new Sentence(sentenceStart, end, true));
        }
        return sentences;
    }

    private boolean isAbbreviation(String text, int periodIndex) {
        if (text.charAt(periodIndex) != '.') {
            return false;
        }
        int wordStart = periodIndex;
        while (wordStart > 0 && !Character.isWhitespace(text.charAt(wordStart - 1))
                && text.charAt(wordStart - 1) != '(') {
            wordStart--;
        }
        String word = text.substring(wordStart, periodIndex).toLowerCase(Locale.ROOT);
        if (word.length() == 1 && Character.isLetter(word.charAt(0))) {
            return true;
        }
        return ABBREVIATIONS.contains(word);
    }

    private boolean insideEntity(int offset, List<EntitySpan> entities) {
        for (EntitySpan span : entities) {
            if (span.start() >= offset) {
                break;
            }
            if (span.contains(offset)) {
                return true;
            }
        }
        return false;
    }

    private boolean startsParagraph(String text, int offset) {
        int newlines = 0;
        for (int i = offset; i < text.length() && Character.isWhitespace(text.charAt(i)); i++) {
            if (text.charAt(i) == '\n' && ++newlines >= 2) {
                return true;
            }
        }
        return false;
    }

    private int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private int trimEnd(String text, int start, int end) {
        int i = end;
        while (i > start && Character.isWhitespace(text.charAt(i - 1))) {
            i--;
        }
        return i;
    }
}
