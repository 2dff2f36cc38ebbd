package com.production.scholar_service.service.metadata;

import java.text.Normalizer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fuzzy comparison of titles and author lists.
 */
public final class StringSimilarity {

    private static final double TITLE_WEIGHT = 50;
    private static final double AUTHOR_WEIGHT = 30;

    private StringSimilarity() {
    }

    /**
     * Normalized Levenshtein ratio in [0, 1] over case-folded, punctuation-free text.
     */
    public static double ratio(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int distance = levenshtein(left, right);
        return 1.0 - (double) distance / Math.max(left.length(), right.length());
    }

    /**
     * Share of the expected authors' surnames that appear among the found authors.
     */
    public static double authorOverlap(List<String> expected, List<String> found) {
        Set<String> expectedSurnames = surnames(expected);
        if (expectedSurnames.isEmpty()) {
            return 0.0;
        }
        Set<String> foundSurnames = surnames(found);
        long hits = expectedSurnames.stream().filter(foundSurnames::contains).count();
        return (double) hits / expectedSurnames.size();
    }

    /**
     * Title similarity weighted 50 to author similarity 30; title only when no authors are expected.
     */
    public static double matchScore(String expectedTitle, List<String> expectedAuthors,
                                    String foundTitle, List<String> foundAuthors) {
        double title = ratio(expectedTitle, foundTitle);
        if (expectedAuthors == null || expectedAuthors.isEmpty()) {
            return title;
        }
        double authors = authorOverlap(expectedAuthors, foundAuthors);
        return (TITLE_WEIGHT * title + AUTHOR_WEIGHT * authors) / (TITLE_WEIGHT + AUTHOR_WEIGHT);
    }

    public static String surname(String author) {
        if (author == null || author.isBlank()) {
            return "";
        }
        String name = author.trim();
        int comma = name.indexOf(',');
        if (comma > 0) {
            return normalize(name.substring(0, comma));
        }
        String[] parts = name.split("\\s+");
        return normalize(parts[parts.length - 1]);
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return decomposed.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim();
    }

    private static Set<String> surnames(List<String> authors) {
        Set<String> result = new LinkedHashSet<>();
        if (authors != null) {
            for (String author : authors) {
                String surname = surname(author);
                if (!surname.isEmpty()) {
                    result.add(surname);
                }
            }
        }
        return result;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
