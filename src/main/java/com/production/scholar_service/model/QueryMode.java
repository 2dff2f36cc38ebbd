package com.production.scholar_service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryMode {
    /** Vector retrieval followed by a generated, cited answer. */
    QUESTION,
    SEMANTIC,
    KEYWORD;

    @JsonCreator
    public static QueryMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return QUESTION;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown query mode: " + value + " (use question, semantic or keyword)");
        }
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
