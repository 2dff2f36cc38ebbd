package com.production.scholar_service.service.metadata;

/**
 * How a single source fared during one harvest.
 */
public enum SourceOutcome {
    /** Answered with at least one candidate above the similarity floor. */
    OK,
    /** Answered, but nothing usable. */
    EMPTY,
    /** Network error, HTTP error or unreadable response. */
    UNAVAILABLE,
    /** No answer within the per-source timeout. */
    TIMEOUT,
    /** Not queried: not selected, or the hints were insufficient. */
    SKIPPED
}
