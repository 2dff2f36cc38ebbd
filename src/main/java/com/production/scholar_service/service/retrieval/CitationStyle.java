package com.production.scholar_service.service.retrieval;

import java.util.Locale;

public enum CitationStyle {
    APA,
    MLA,
    CHICAGO,
    HARVARD,
    IEEE;

    public static CitationStyle fromString(String value) {
        if (value != null) {
            for (CitationStyle style : values()) {
                if (style.name().equalsIgnoreCase(value.trim())) {
                    return style;
                }
            }
        }
        throw new IllegalArgumentException("Unknown citation style: " + value
                + " (use apa, mla, chicago, harvard or ieee)");
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
