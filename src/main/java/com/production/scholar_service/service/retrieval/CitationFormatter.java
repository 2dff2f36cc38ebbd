package com.production.scholar_service.service.retrieval;

import com.production.scholar_service.model.Metadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reference-list entries and inline citations built from a {@link Metadata} record.
 *
 * Pure string formatting: no lookups, no state. Italics are marked with {@code *...*},
 * a missing year prints as "n.d." and a missing title as "Untitled".
 */
@Component
public class CitationFormatter {

    static final String NO_DATE = "n.d.";
    static final String UNTITLED = "Untitled";
    private static final String DOI_RESOLVER = "https://doi.org/";

    public String format(Metadata metadata, CitationStyle style) {
        return switch (style) {
            case APA -> apa(metadata);
            case MLA -> mla(metadata);
            case CHICAGO -> chicago(metadata);
            case HARVARD -> harvard(metadata);
            case IEEE -> ieee(metadata);
        };
    }

    /**
     * Inline citation for a passage, e.g. {@code (Doe, 2020, p. 5)} in APA.
     *
     * @param page   1-based page, omitted when null or not positive
     * @param marker source number, used by IEEE only
     */
    public String inline(Metadata metadata, CitationStyle style, Integer page, int marker) {
        String pageText = page != null && page > 0 ? String.valueOf(page) : null;
        String author = inlineAuthor(metadata, style);
        String year = year(metadata);
        return switch (style) {
            case APA -> "(" + author + ", " + year + (pageText != null ? ", p. " + pageText : "") + ")";
            case MLA -> "(" + author + (pageText != null ? " " + pageText : "") + ")";
            case CHICAGO -> "(" + author + " " + year + (pageText != null ? ", " + pageText : "") + ")";
            case HARVARD -> "(" + author + ", " + year + (pageText != null ? ": " + pageText : "") + ")";
            case IEEE -> "[" + marker + "]";
        };
    }

    private String apa(Metadata metadata) {
        StringBuilder citation = new StringBuilder();
        String authors = apaAuthors(names(metadata));
        if (!authors.isEmpty()) {
            citation.append(withPeriod(authors)).append(' ');
        }
        citation.append('(').append(year(metadata)).append("). ");

        String title = title(metadata);
        citation.append(isArticle(metadata) ? withPeriod(title) : italicWithPeriod(title)).append(' ');

        String journal = metadata.getJournal();
        if (!isBlank(journal)) {
            citation.append('*').append(journal).append('*');
            String volume = extra(metadata, "volume");
            if (volume != null) {
                citation.append(", ").append(volume);
                String issue = extra(metadata, "issue");
                if (issue != null) {
                    citation.append('(').append(issue).append(')');
                }
            }
            String pages = extra(metadata, "pages");
            if (pages != null) {
                citation.append(", ").append(pages);
            }
            citation.append('.');
        } else if (!isBlank(metadata.getPublisher())) {
            citation.append(withPeriod(metadata.getPublisher()));
        }

        if (!isBlank(metadata.getDoi())) {
            citation.append(' ').append(doiUrl(metadata.getDoi()));
        }
        return citation.toString().trim();
    }

    private String mla(Metadata metadata) {
        StringBuilder citation = new StringBuilder();
        String authors = mlaAuthors(names(metadata));
        if (!authors.isEmpty()) {
            citation.append(withPeriod(authors)).append(' ');
        }

        String title = title(metadata);
        boolean article = isArticle(metadata);
        citation.append(article ? quotedWithPeriod(title) : italicWithPeriod(title)).append(' ');

        String journal = metadata.getJournal();
        if (!isBlank(journal)) {
            citation.append('*').append(journal).append('*');
            String volume = extra(metadata, "volume");
            if (volume != null) {
                citation.append(", vol. ").append(volume);
            }
            String issue = extra(metadata, "issue");
            if (issue != null) {
                citation.append(", no. ").append(issue);
            }
            citation.append(", ");
        }
        if (!isBlank(metadata.getPublisher())) {
            citation.append(metadata.getPublisher()).append(", ");
        }
        citation.append(year(metadata));
        String pages = extra(metadata, "pages");
        if (pages != null && !isBlank(journal)) {
            citation.append(", pp. ").append(pages);
        }
        if (!isBlank(metadata.getDoi())) {
            citation.append(", ").append(doiUrl(metadata.getDoi()));
        }
        return withPeriod(citation.toString());
    }

    private String chicago(Metadata metadata) {
        StringBuilder citation = new StringBuilder();
        String authors = chicagoAuthors(names(metadata));
        if (!authors.isEmpty()) {
            citation.append(withPeriod(authors)).append(' ');
        }

        String title = title(metadata);
        citation.append(isArticle(metadata) ? quotedWithPeriod(title) : italicWithPeriod(title)).append(' ');

        String journal = metadata.getJournal();
        if (!isBlank(journal)) {
            citation.append('*').append(journal).append('*');
            String volume = extra(metadata, "volume");
            if (volume != null) {
                citation.append(' ').append(volume);
            }
            String issue = extra(metadata, "issue");
            if (issue != null) {
                citation.append(", no. ").append(issue);
            }
            citation.append(" (").append(year(metadata)).append(')');
            String pages = extra(metadata, "pages");
            if (pages != null) {
                citation.append(": ").append(pages);
            }
            citation.append('.');
        } else if (!isBlank(metadata.getPublisher())) {
            citation.append(metadata.getPublisher()).append(", ").append(withPeriod(year(metadata)));
        } else {
            citation.append(withPeriod(year(metadata)));
        }

        if (!isBlank(metadata.getDoi())) {
            citation.append(' ').append(doiUrl(metadata.getDoi())).append('.');
        }
        return citation.toString();
    }

    private String harvard(Metadata metadata) {
        StringBuilder citation = new StringBuilder();
        String authors = harvardAuthors(names(metadata));
        if (!authors.isEmpty()) {
            citation.append(authors).append(' ');
        }
        citation.append('(').append(year(metadata)).append(") ");

        String title = title(metadata);
        String journal = metadata.getJournal();
        if (isArticle(metadata)) {
            citation.append('\'').append(title).append("', ");
        } else {
            citation.append('*').append(title).append("*. ");
        }

        if (!isBlank(journal)) {
            citation.append('*').append(journal).append('*');
            String volume = extra(metadata, "volume");
            if (volume != null) {
                citation.append(", ").append(volume);
                String issue = extra(metadata, "issue");
                if (issue != null) {
                    citation.append('(').append(issue).append(')');
                }
            }
            String pages = extra(metadata, "pages");
            if (pages != null) {
                citation.append(", pp. ").append(pages);
            }
            citation.append('.');
        } else if (!isBlank(metadata.getPublisher())) {
            citation.append(withPeriod(metadata.getPublisher()));
        }

        if (!isBlank(metadata.getDoi())) {
            citation.append(" Available at: ").append(doiUrl(metadata.getDoi())).append('.');
        }
        return citation.toString().trim();
    }

    private String ieee(Metadata metadata) {
        StringBuilder citation = new StringBuilder();
        String authors = ieeeAuthors(names(metadata));
        if (!authors.isEmpty()) {
            citation.append(authors).append(", ");
        }
        citation.append('"').append(title(metadata)).append(",\" ");

        String journal = metadata.getJournal();
        if (!isBlank(journal)) {
            citation.append('*').append(journal).append('*');
            String volume = extra(metadata, "volume");
            if (volume != null) {
                citation.append(", vol. ").append(volume);
            }
            String issue = extra(metadata, "issue");
            if (issue != null) {
                citation.append(", no. ").append(issue);
            }
            String pages = extra(metadata, "pages");
            if (pages != null) {
                citation.append(", pp. ").append(pages);
            }
            citation.append(", ").append(withPeriod(year(metadata)));
        } else if (!isBlank(metadata.getPublisher())) {
            citation.append(metadata.getPublisher()).append(", ").append(withPeriod(year(metadata)));
        } else {
            citation.append(withPeriod(year(metadata)));
        }

        if (!isBlank(metadata.getDoi())) {
            citation.append(" doi: ").append(metadata.getDoi()).append('.');
        }
        return citation.toString();
    }

    static String apaAuthors(List<PersonName> names) {
        List<String> formatted = names.stream().map(PersonName::familyWithInitials).toList();
        if (formatted.isEmpty()) {
            return "";
        }
        if (formatted.size() == 1) {
            return formatted.get(0);
        }
        if (formatted.size() <= 20) {
            return String.join(", ", formatted.subList(0, formatted.size() - 1))
                    + ", & " + formatted.get(formatted.size() - 1);
        }
        return String.join(", ", formatted.subList(0, 19)) + ", ... " + formatted.get(formatted.size() - 1);
    }

    static String mlaAuthors(List<PersonName> names) {
        return switch (names.size()) {
            case 0 -> "";
            case 1 -> names.get(0).inverted();
            case 2 -> names.get(0).inverted() + ", and " + names.get(1).natural();
            default -> names.get(0).inverted() + ", et al.";
        };
    }

    static String chicagoAuthors(List<PersonName> names) {
        return switch (names.size()) {
            case 0 -> "";
            case 1 -> names.get(0).inverted();
            case 2 -> names.get(0).inverted() + ", and " + names.get(1).natural();
            case 3 -> names.get(0).inverted() + ", " + names.get(1).natural() + ", and " + names.get(2).natural();
            default -> names.get(0).inverted() + ", et al.";
        };
    }

    static String harvardAuthors(List<PersonName> names) {
        List<String> formatted = names.stream().map(PersonName::familyWithInitials).toList();
        return switch (formatted.size()) {
            case 0 -> "";
            case 1 -> formatted.get(0);
            case 2 -> formatted.get(0) + " and " + formatted.get(1);
            case 3 -> formatted.get(0) + ", " + formatted.get(1) + " and " + formatted.get(2);
            default -> formatted.get(0) + " et al.";
        };
    }

    static String ieeeAuthors(List<PersonName> names) {
        List<String> formatted = names.stream().map(PersonName::initialsFirst).toList();
        return switch (formatted.size()) {
            case 0 -> "";
            case 1 -> formatted.get(0);
            case 2 -> formatted.get(0) + " and " + formatted.get(1);
            default -> String.join(", ", formatted.subList(0, formatted.size() - 1))
                    + ", and " + formatted.get(formatted.size() - 1);
        };
    }

    private static String inlineAuthor(Metadata metadata, CitationStyle style) {
        List<PersonName> names = names(metadata);
        if (names.isEmpty()) {
            return isBlank(metadata.getTitle()) ? "Anon." : shortTitle(metadata.getTitle());
        }
        if (names.size() == 1) {
            return names.get(0).family();
        }
        if (names.size() == 2) {
            String conjunction = style == CitationStyle.APA ? " & " : " and ";
            return names.get(0).family() + conjunction + names.get(1).family();
        }
        return names.get(0).family() + " et al.";
    }

    private static String shortTitle(String title) {
        String[] words = title.trim().split("\\s+");
        if (words.length <= 4) {
            return "\"" + title.trim() + "\"";
        }
        return "\"" + String.join(" ", List.of(words).subList(0, 4)) + "\"";
    }

    static List<PersonName> names(Metadata metadata) {
        List<PersonName> names = new ArrayList<>();
        if (metadata.getAuthors() != null) {
            for (String author : metadata.getAuthors()) {
                if (!isBlank(author)) {
                    names.add(PersonName.parse(author));
                }
            }
        }
        return names;
    }

    private static boolean isArticle(Metadata metadata) {
        if (!isBlank(metadata.getJournal())) {
            return true;
        }
        String type = extra(metadata, "type");
        return type != null && type.toLowerCase(Locale.ROOT).contains("article");
    }

    private static String title(Metadata metadata) {
        return isBlank(metadata.getTitle()) ? UNTITLED : metadata.getTitle().trim();
    }

    private static String year(Metadata metadata) {
        return metadata.getYear() == null ? NO_DATE : String.valueOf(metadata.getYear());
    }

    private static String extra(Metadata metadata, String key) {
        Object value = metadata.getExtra() == null ? null : metadata.getExtra().get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return null;
        }
        return String.valueOf(value).trim();
    }

    private static String doiUrl(String doi) {
        String trimmed = doi.trim();
        return trimmed.startsWith(DOI_RESOLVER) ? trimmed : DOI_RESOLVER + trimmed;
    }

    private static String withPeriod(String text) {
        return endsSentence(text) ? text : text + ".";
    }

    private static String italicWithPeriod(String text) {
        return "*" + text + "*" + (endsSentence(text) ? "" : ".");
    }

    private static String quotedWithPeriod(String text) {
        return "\"" + withPeriod(text) + "\"";
    }

    private static boolean endsSentence(String text) {
        return text.endsWith(".") || text.endsWith("?") || text.endsWith("!");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * An author name split into given names and family name. Accepts "Family, Given" and "Given Family".
     */
    record PersonName(String given, String family) {

        static PersonName parse(String author) {
            String name = author.trim().replaceAll("\\s+", " ");
            int comma = name.indexOf(',');
            if (comma > 0) {
                return new PersonName(name.substring(comma + 1).trim(), name.substring(0, comma).trim());
            }
            int space = name.lastIndexOf(' ');
            if (space < 0) {
                return new PersonName("", name);
            }
            return new PersonName(name.substring(0, space), name.substring(space + 1));
        }

        /** "Hans-Peter Maria" becomes "H.-P. M.". */
        String initials() {
            if (given.isBlank()) {
                return "";
            }
            List<String> initials = new ArrayList<>();
            for (String token : given.split(" ")) {
                List<String> pieces = new ArrayList<>();
                for (String piece : token.split("-")) {
                    if (!piece.isEmpty()) {
                        pieces.add(piece.charAt(0) + ".");
                    }
                }
                if (!pieces.isEmpty()) {
                    initials.add(String.join("-", pieces));
                }
            }
            return String.join(" ", initials);
        }

        String familyWithInitials() {
            String initials = initials();
            return initials.isEmpty() ? family : family + ", " + initials;
        }

        String initialsFirst() {
            String initials = initials();
            return initials.isEmpty() ? family : initials + " " + family;
        }

        String inverted() {
            return given.isBlank() ? family : family + ", " + given;
        }

        String natural() {
            return given.isBlank() ? family : given + " " + family;
        }
    }
}
