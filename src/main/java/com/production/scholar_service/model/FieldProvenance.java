package com.production.scholar_service.model;

/**
 * Which source supplied an accepted metadata value, and how sure it was.
 */
public record FieldProvenance(String source, double confidence) {

    public static final String LOCAL = "local";
    public static final String PROPERTIES = "properties";
    public static final String MANUAL = "manual";

    public static FieldProvenance manual() {
        return new FieldProvenance(MANUAL, 1.0);
    }
}
