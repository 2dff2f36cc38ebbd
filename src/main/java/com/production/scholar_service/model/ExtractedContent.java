package com.production.scholar_service.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Raw text of a single file, page by page, plus the properties embedded in the file itself.
 * Formats without real pages (plain text, EPUB) report a single page.
 */
@Data
@Builder
public class ExtractedContent {

    public static final String PROP_TITLE = "title";
    public static final String PROP_AUTHOR = "author";
    public static final String PROP_SUBJECT = "subject";
    public static final String PROP_KEYWORDS = "keywords";
    public static final String PROP_CREATED = "created";
    public static final String PROP_PUBLISHER = "publisher";
    public static final String PROP_IDENTIFIER = "identifier";
    public static final String PROP_LANGUAGE = "language";

    private DocumentFormat format;

    @Builder.Default
    private List<PageContent> pages = new ArrayList<>();

    @Builder.Default
    private Map<String, String> properties = new TreeMap<>();

    /** Page count reported by the file itself when it differs from the extracted page list (DOCX). */
    private Integer declaredPageCount;

    public int getPageCount() {
        return declaredPageCount != null && declaredPageCount > 0 ? declaredPageCount : pages.size();
    }

    public String fullText() {
        return pages.stream()
                .map(p -> p.getCleanedText() != null ? p.getCleanedText() : p.getRawText())
                .filter(t -> t != null && !t.isBlank())
                .collect(Collectors.joining("\n\n"));
    }

    public String property(String key) {
        String value = properties.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
