package com.production.scholar_service.service.metadata;

import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.FieldProvenance;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataField;
import com.production.scholar_service.model.PageContent;
import com.production.scholar_service.service.segment.LanguageDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Year;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives first-guess metadata from a document alone: embedded file properties first,
 * then heuristics over the text of the first pages. The result doubles as the hint set
 * for the external sources and as the fallback for fields none of them supply.
 */
@Component
@Slf4j
public class LocalMetadataExtractor {

    static final double PROPERTIES_CONFIDENCE = 0.8;
    static final double TEXT_CONFIDENCE = 0.5;

    private static final int HEAD_PAGES = 3;
    private static final int HEAD_CHARS = 10_000;
    private static final int MIN_YEAR = 1900;

    static final List<String> KNOWN_PUBLISHERS = List.of(
            "Springer Nature", "Elsevier", "Springer", "Wiley", "IEEE", "ACM", "Nature", "Science",
            "Oxford University Press", "Cambridge University Press", "MIT Press", "Taylor & Francis",
            "SAGE", "Wolters Kluwer", "De Gruyter", "Thieme", "Hanser", "Academic Press");

    static final List<String> KNOWN_JOURNALS = List.of(
            "Journal of the American Chemical Society", "Journal of Machine Learning Research",
            "New England Journal of Medicine", "Nucleic Acids Research", "IEEE Transactions",
            "ACM Transactions", "Physical Review", "Angewandte Chemie", "Bioinformatics",
            "PLOS ONE", "The Lancet", "PNAS", "JAMA", "Nature", "Science", "Cell");

    private static final Pattern DOI_IN_TEXT = Pattern.compile(
            "(?i)(?:doi[:\\s]*|https?://(?:dx\\.)?doi\\.org/)?(10\\.\\d{4,9}/[-._;()/:a-zA-Z0-9]+)");

    private static final Pattern ISBN_IN_TEXT = Pattern.compile(
            "(?i)ISBN(?:-1[03])?:?\\s*((?:97[89][-\\s]?)?\\d{1,5}[-\\s]?\\d{1,7}[-\\s]?\\d{1,7}[-\\s]?[\\dX])"
                    + "|\\b(97[89]\\d{10}|\\d{9}[\\dX])\\b");

    private static final List<Pattern> STRONG_YEAR = List.of(
            Pattern.compile("(?i)(?:published|accepted|received|publiziert|erschienen)[^\\n\\d]{0,30}((?:19|20)\\d{2})"),
            Pattern.compile("(?i)(?:copyright|©|\\(c\\))\\s*((?:19|20)\\d{2})"),
            Pattern.compile("(?i)vol(?:ume)?\\.?\\s*\\d+\\s*\\(((?:19|20)\\d{2})\\)"),
            Pattern.compile("(?i)(?:january|february|march|april|may|june|july|august|september|october|november|december"
                    + "|januar|februar|märz|juni|juli|oktober|dezember)\\s+((?:19|20)\\d{2})"));

    private static final Pattern ANY_YEAR = Pattern.compile("\\b((?:19|20)\\d{2})\\b");

    private static final Pattern JOURNAL_PHRASE = Pattern.compile(
            "\\b((?:Journal|Zeitschrift|Proceedings|Annals|Archives|Transactions) (?:of|für|on) "
                    + "(?:(?:the|and|for|of|on|in|und|für) )?\\p{Lu}[\\w&-]*"
                    + "(?: (?:(?:the|and|for|of|on|in|und|für) )?\\p{Lu}[\\w&-]*)*)");

    private static final Pattern PUBLISHED_BY = Pattern.compile(
            "(?i)(?:published by|publisher:|verlag:)\\s*([A-Z][^\\n,.;]{2,60})");

    private static final Pattern AUTHOR_LINE = Pattern.compile(
            "(?i)^(?:authors?|autor(?:en)?|by|von)\\s*[:]?\\s+(.+)$");

    private static final Pattern PERSON_NAME = Pattern.compile(
            "\\p{Lu}[\\p{L}'-]+(?:\\s+(?:\\p{Lu}\\.|\\p{Lu}[\\p{L}'-]+|van|von|de|der|den|la))*\\s+\\p{Lu}[\\p{L}'-]+");

    private static final Pattern NAME_SEPARATOR = Pattern.compile("\\s*(?:,|;|\\band\\b|\\bund\\b|&)\\s*");

    private static final Pattern NON_TITLE_LINE = Pattern.compile(
            "(?i)^(?:abstract|zusammenfassung|keywords|schlüsselwörter|introduction|einleitung|contents|inhalt"
                    + "|table of contents|doi|https?:|www\\.|©|copyright|received|accepted|published|vol\\.|volume"
                    + "|arxiv|preprint|page|seite|issn|isbn).*");

    private static final Set<String> PLACEHOLDER_TITLES = Set.of("untitled", "unbenannt", "title", "document", "dokument");

    private final LanguageDetector languageDetector;

    public LocalMetadataExtractor(LanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
    }

    /**
     * Builds metadata from file properties and raw page text. Fields found in properties carry
     * provenance "properties", fields found in text carry "local".
     */
    public Metadata extract(ExtractedContent content) {
        Map<String, String> properties = content.getProperties() != null ? content.getProperties() : new TreeMap<>();
        String head = headText(content);
        Metadata metadata = new Metadata();

        FieldProvenance fromProperties = new FieldProvenance(FieldProvenance.PROPERTIES, PROPERTIES_CONFIDENCE);
        FieldProvenance fromText = new FieldProvenance(FieldProvenance.LOCAL, TEXT_CONFIDENCE);

        String propertyTitle = cleanPropertyTitle(content.property(ExtractedContent.PROP_TITLE));
        if (propertyTitle != null) {
            metadata.set(MetadataField.TITLE, propertyTitle, fromProperties);
        } else {
            metadata.set(MetadataField.TITLE, findTitle(head), fromText);
        }

        List<String> propertyAuthors = splitAuthors(content.property(ExtractedContent.PROP_AUTHOR));
        if (!propertyAuthors.isEmpty()) {
            metadata.set(MetadataField.AUTHORS, propertyAuthors, fromProperties);
        } else {
            metadata.set(MetadataField.AUTHORS, findAuthors(head, metadata.getTitle()), fromText);
        }

        String propertyDoi = firstNonNull(
                Identifiers.normalizeDoi(content.property(ExtractedContent.PROP_IDENTIFIER)),
                Identifiers.normalizeDoi(content.property(ExtractedContent.PROP_SUBJECT)),
                Identifiers.normalizeDoi(content.property(ExtractedContent.PROP_KEYWORDS)));
        if (propertyDoi != null) {
            metadata.set(MetadataField.DOI, propertyDoi, fromProperties);
        } else {
            metadata.set(MetadataField.DOI, findDoi(head), fromText);
        }

        String propertyIsbn = Identifiers.normalizeIsbn(content.property(ExtractedContent.PROP_IDENTIFIER));
        if (propertyIsbn != null) {
            metadata.set(MetadataField.ISBN, propertyIsbn, fromProperties);
        } else {
            metadata.set(MetadataField.ISBN, findIsbn(head), fromText);
        }

        Integer year = findYear(head);
        if (year != null) {
            metadata.set(MetadataField.YEAR, year, fromText);
        } else {
            metadata.set(MetadataField.YEAR, yearOf(content.property(ExtractedContent.PROP_CREATED)), fromProperties);
        }

        String propertyPublisher = content.property(ExtractedContent.PROP_PUBLISHER);
        if (propertyPublisher != null) {
            metadata.set(MetadataField.PUBLISHER, propertyPublisher, fromProperties);
        } else {
            metadata.set(MetadataField.PUBLISHER, findPublisher(head), fromText);
        }
        metadata.set(MetadataField.JOURNAL, findJournal(head), fromText);

        metadata.set(MetadataField.LANGUAGE, languageDetector.detect(fullRawText(content)), fromText);
        metadata.set(MetadataField.PAGE_COUNT, content.getPageCount(), fromText);

        log.debug("Local metadata: title='{}', authors={}, year={}, doi={}, isbn={}",
                metadata.getTitle(), metadata.getAuthors(), metadata.getYear(), metadata.getDoi(), metadata.getIsbn());
        return metadata;
    }

    String findDoi(String text) {
        Matcher matcher = DOI_IN_TEXT.matcher(text);
        while (matcher.find()) {
            String doi = Identifiers.normalizeDoi(matcher.group(1));
            if (doi != null) {
                return doi;
            }
        }
        return null;
    }

    String findIsbn(String text) {
        Matcher matcher = ISBN_IN_TEXT.matcher(text);
        while (matcher.find()) {
            String raw = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String isbn = Identifiers.normalizeIsbn(raw);
            if (isbn != null) {
                return isbn;
            }
        }
        return null;
    }

    /**
     * Explicit publication phrases win; otherwise the most frequent plausible year, later year on ties.
     */
    Integer findYear(String text) {
        int maxYear = Year.now().getValue() + 1;
        for (Pattern pattern : STRONG_YEAR) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                int year = Integer.parseInt(matcher.group(1));
                if (year >= MIN_YEAR && year <= maxYear) {
                    return year;
                }
            }
        }
        Map<Integer, Integer> counts = new TreeMap<>();
        Matcher matcher = ANY_YEAR.matcher(text);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (year >= MIN_YEAR && year <= maxYear) {
                counts.merge(year, 1, Integer::sum);
            }
        }
        Integer best = null;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() >= bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    String findPublisher(String text) {
        Matcher matcher = PUBLISHED_BY.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return findKnown(text, KNOWN_PUBLISHERS);
    }

    String findJournal(String text) {
        String known = findKnown(text, KNOWN_JOURNALS);
        if (known != null) {
            return known;
        }
        Matcher matcher = JOURNAL_PHRASE.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    /**
     * First line of the first page that looks like a title: long enough, not a header and not boilerplate.
     */
    String findTitle(String head) {
        for (String line : firstLines(head, 15)) {
            if (line.length() < 10 || line.length() > 250) {
                continue;
            }
            if (NON_TITLE_LINE.matcher(line).matches() || Character.isDigit(line.charAt(0))) {
                continue;
            }
            if (line.contains("@") || DOI_IN_TEXT.matcher(line).find()) {
                continue;
            }
            return line;
        }
        return null;
    }

    /**
     * An explicit "Authors:" line, else the line directly below the title when it reads as a list of names.
     */
    List<String> findAuthors(String head, String title) {
        List<String> lines = firstLines(head, 20);
        for (String line : lines) {
            Matcher matcher = AUTHOR_LINE.matcher(line);
            if (matcher.matches()) {
                List<String> names = names(matcher.group(1));
                if (!names.isEmpty()) {
                    return names;
                }
            }
        }
        if (title == null) {
            return new ArrayList<>();
        }
        int titleIndex = lines.indexOf(title);
        if (titleIndex < 0) {
            return new ArrayList<>();
        }
        for (int i = titleIndex + 1; i < Math.min(lines.size(), titleIndex + 4); i++) {
            String candidate = lines.get(i).replaceAll("[\\d*†‡]+", "").trim();
            List<String> names = names(candidate);
            if (!names.isEmpty() && isNameList(candidate, names)) {
                return names;
            }
        }
        return new ArrayList<>();
    }

    static List<String> splitAuthors(String value) {
        if (value == null || value.isBlank()) {
            return new ArrayList<>();
        }
        String[] parts = value.contains(";") ? value.split("\\s*;\\s*") : value.split("\\s+(?:and|und|&)\\s+");
        List<String> authors = new ArrayList<>();
        for (String part : parts) {
            String author = part.trim();
            if (!author.isEmpty()) {
                authors.add(author);
            }
        }
        return authors;
    }

    private static List<String> names(String text) {
        Set<String> names = new LinkedHashSet<>();
        for (String part : NAME_SEPARATOR.split(text)) {
            String trimmed = part.trim();
            if (PERSON_NAME.matcher(trimmed).matches() && trimmed.split("\\s+").length <= 4) {
                names.add(trimmed);
            }
        }
        return new ArrayList<>(names);
    }

    private static boolean isNameList(String line, List<String> names) {
        int nameChars = names.stream().mapToInt(String::length).sum();
        return nameChars >= line.replaceAll("[\\s,;&]|\\band\\b|\\bund\\b", "").length() * 0.6;
    }

    private static String cleanPropertyTitle(String title) {
        if (title == null) {
            return null;
        }
        String cleaned = title.replaceFirst("^Microsoft (?:Word|PowerPoint) - ", "")
                .replaceFirst("\\.(?:docx?|pptx?|pdf)$", "")
                .trim();
        if (cleaned.length() < 4 || PLACEHOLDER_TITLES.contains(cleaned.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return cleaned;
    }

    private static Integer yearOf(String created) {
        if (created == null) {
            return null;
        }
        Matcher matcher = ANY_YEAR.matcher(created);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : null;
    }

    private static String findKnown(String text, List<String> known) {
        String best = null;
        int bestIndex = Integer.MAX_VALUE;
        for (String name : known) {
            Matcher matcher = Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(text);
            if (matcher.find() && matcher.start() < bestIndex) {
                best = name;
                bestIndex = matcher.start();
            }
        }
        return best;
    }

    private static List<String> firstLines(String text, int limit) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim().replaceAll("\\s+", " ");
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
                if (lines.size() == limit) {
                    break;
                }
            }
        }
        return lines;
    }

    private static String headText(ExtractedContent content) {
        StringBuilder head = new StringBuilder();
        List<PageContent> pages = content.getPages();
        for (int i = 0; i < Math.min(HEAD_PAGES, pages.size()) && head.length() < HEAD_CHARS; i++) {
            String raw = pages.get(i).getRawText();
            if (raw != null) {
                head.append(raw).append('\n');
            }
        }
        return head.length() > HEAD_CHARS ? head.substring(0, HEAD_CHARS) : head.toString();
    }

    private static String fullRawText(ExtractedContent content) {
        StringBuilder text = new StringBuilder();
        for (PageContent page : content.getPages()) {
            if (page.getRawText() != null) {
                text.append(page.getRawText()).append('\n');
            }
        }
        return text.toString();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
