package com.production.scholar_service.model;

/**
 * How a source matched its candidate to the document being ingested.
 */
public enum MatchKey {
    DOI,
    ISBN,
    FUZZY;

    public boolean isIdentifier() {
        return this != FUZZY;
    }
}
