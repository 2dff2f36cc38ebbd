package com.production.scholar_service.service.segment;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based recognizer for the entities that matter in scholarly text: identifiers,
 * dates, people and organizations. Overlaps resolve to the earliest, then longest, match.
 */
@Component
public class EntityRecognizer {

    public static final String DOI = "DOI";
    public static final String ISBN = "ISBN";
    public static final String URL = "URL";
    public static final String EMAIL = "EMAIL";
    public static final String DATE = "DATE";
    public static final String YEAR = "YEAR";
    public static final String PERSON = "PERSON";
    public static final String ORG = "ORG";

    private static final String MONTHS = "(?:January|February|March|April|May|June|July|August|September|October|November|December"
            + "|Januar|Februar|März|Mai|Juni|Juli|Oktober|Dezember"
            + "|Jan\\.|Feb\\.|Mar\\.|Apr\\.|Aug\\.|Sep\\.|Sept\\.|Oct\\.|Okt\\.|Nov\\.|Dec\\.|Dez\\.)";

    private static final String NAME = "[A-ZÄÖÜ][a-zäöüß]+(?:-[A-ZÄÖÜ][a-zäöüß]+)?";

    // Insertion order is the priority order for spans starting at the same offset and of equal length
    private static final Map<String, List<Pattern>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(URL, List.of(Pattern.compile("https?://[^\\s<>\"]+[^\\s<>\".,;:)\\]]")));
        PATTERNS.put(DOI, List.of(Pattern.compile("\\b10\\.\\d{4,9}/[-._;()/:A-Za-z0-9]*[A-Za-z0-9]")));
        PATTERNS.put(EMAIL, List.of(Pattern.compile("\\b[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)*\\.[A-Za-z]{2,}\\b")));
        PATTERNS.put(ISBN, List.of(Pattern.compile(
                "\\bISBN(?:-1[03])?:?\\s*(?:97[89][- ]?)?\\d{1,5}[- ]?\\d{1,7}[- ]?\\d{1,7}[- ]?[\\dXx]\\b")));
        PATTERNS.put(DATE, List.of(
                Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b"),
                Pattern.compile("\\b\\d{1,2}\\.\\s?\\d{1,2}\\.\\s?\\d{4}\\b"),
                Pattern.compile("\\b\\d{1,2}\\.?\\s+" + MONTHS + "\\s+\\d{4}\\b"),
                Pattern.compile("\\b" + MONTHS + "\\s+\\d{1,2},\\s+\\d{4}\\b"),
                Pattern.compile("\\b" + MONTHS + "\\s+\\d{4}\\b")));
        PATTERNS.put(PERSON, List.of(
                Pattern.compile("\\b(?:Prof\\.|Dr\\.|Mr\\.|Mrs\\.|Ms\\.|Professor|Professorin)(?:\\s+(?:Dr\\.|rer\\.|nat\\.))*"
                        + "\\s+(?:[A-Z]\\.\\s?)*" + NAME + "(?:\\s+" + NAME + ")?"),
                Pattern.compile("\\b[A-Z]\\.\\s?(?:[A-Z]\\.\\s?)?" + NAME),
                Pattern.compile("\\b" + NAME + " et al\\.")));
        PATTERNS.put(ORG, List.of(
                Pattern.compile("\\b(?:University|Universität|Institute|Institut|Department|Hochschule|Academy|Akademie)"
                        + "\\s+(?:of|for|für|der)\\s+[A-ZÄÖÜ][\\wäöüß-]*(?:\\s+(?:and\\s+)?[A-ZÄÖÜ][\\wäöüß-]*)*"),
                Pattern.compile("\\b(?:[A-ZÄÖÜ][\\wäöüß&-]*\\s+)+(?:University|Universität|Institute|GmbH|AG|Inc\\.|Ltd\\.|Corporation|Press|Verlag)\\b")));
        PATTERNS.put(YEAR, List.of(Pattern.compile("\\b(?:1[89]\\d{2}|20\\d{2})\\b")));
    }

    public List<EntitySpan> recognize(String text) {
        List<EntitySpan> all = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return all;
        }
        int priority = 0;
        Map<EntitySpan, Integer> priorities = new LinkedHashMap<>();
        for (Map.Entry<String, List<Pattern>> entry : PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher matcher = pattern.matcher(text);
                while (matcher.find()) {
                    EntitySpan span = new EntitySpan(entry.getKey(), matcher.group().trim(), matcher.start(), matcher.end());
                    all.add(span);
                    priorities.putIfAbsent(span, priority);
                }
            }
            priority++;
        }

        all.sort(Comparator.comparingInt(EntitySpan::start)
                .thenComparing(Comparator.comparingInt(EntitySpan::length).reversed())
                .thenComparingInt(priorities::get));

        List<EntitySpan> accepted = new ArrayList<>();
        int coveredUntil = -1;
        for (EntitySpan span : all) {
            if (span.start() >= coveredUntil) {
                accepted.add(span);
                coveredUntil = span.end();
            }
        }
        return accepted;
    }
}
