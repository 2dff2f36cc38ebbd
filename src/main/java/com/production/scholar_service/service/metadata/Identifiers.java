package com.production.scholar_service.service.metadata;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DOI and ISBN normalization and validation.
 */
public final class Identifiers {

    private static final Pattern DOI = Pattern.compile("10\\.\\d{4,9}/[^\\s\"<>]+");
    private static final Pattern ISBN_RUN = Pattern.compile(
            "(?<!\\d)(?:97[89][-\\s]?(?:\\d[-\\s]?){9}\\d|(?:\\d[-\\s]?){9}[\\dXx])(?![\\dXx])");

    private Identifiers() {
    }

    /**
     * Lower-cased bare DOI ("10.x/y"), or null if the value contains none.
     */
    public static String normalizeDoi(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = DOI.matcher(value.trim());
        if (!matcher.find()) {
            return null;
        }
        String doi = matcher.group();
        while (!doi.isEmpty() && ".,;:)]}'".indexOf(doi.charAt(doi.length() - 1)) >= 0) {
            doi = doi.substring(0, doi.length() - 1);
        }
        return doi.toLowerCase(Locale.ROOT);
    }

    /**
     * Digits (and a trailing X) of a valid ISBN-10 or ISBN-13, or null.
     */
    public static String normalizeIsbn(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = ISBN_RUN.matcher(value.replaceAll("(?i)isbn(-1[03])?:?", ""));
        if (!matcher.find()) {
            return null;
        }
        String compact = matcher.group().replaceAll("[\\s-]", "").toUpperCase(Locale.ROOT);
        return isValidIsbn(compact) ? compact : null;
    }

    public static boolean isValidIsbn(String isbn) {
        if (isbn == null) {
            return false;
        }
        if (isbn.matches("\\d{9}[\\dX]")) {
            int sum = 0;
            for (int i = 0; i < 10; i++) {
                char c = isbn.charAt(i);
                int digit = c == 'X' ? 10 : c - '0';
                sum += digit * (10 - i);
            }
            return sum % 11 == 0;
        }
        if (isbn.matches("\\d{13}")) {
            int sum = 0;
            for (int i = 0; i < 13; i++) {
                int digit = isbn.charAt(i) - '0';
                sum += i % 2 == 0 ? digit : digit * 3;
            }
            return sum % 10 == 0;
        }
        return false;
    }

    /**
     * ISBN-13 form of a valid ISBN, used to compare ISBN-10 and ISBN-13 spellings of the same book.
     */
    public static String toIsbn13(String isbn) {
        String normalized = normalizeIsbn(isbn);
        if (normalized == null || normalized.length() == 13) {
            return normalized;
        }
        String body = "978" + normalized.substring(0, 9);
        int sum = 0;
        for (int i = 0; i < 12; i++) {
            int digit = body.charAt(i) - '0';
            sum += i % 2 == 0 ? digit : digit * 3;
        }
        return body + ((10 - sum % 10) % 10);
    }

    public static boolean sameIsbn(String a, String b) {
        String left = toIsbn13(a);
        return left != null && left.equals(toIsbn13(b));
    }

    public static boolean sameDoi(String a, String b) {
        String left = normalizeDoi(a);
        return left != null && left.equals(normalizeDoi(b));
    }
}
