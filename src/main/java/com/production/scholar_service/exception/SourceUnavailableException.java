package com.production.scholar_service.exception;

import lombok.Getter;

/**
 * A bibliographic source could not be reached or answered with an error.
 * Recorded by the harvester and never propagated past it.
 */
@Getter
public class SourceUnavailableException extends Exception {

    private final String source;

    public SourceUnavailableException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }
}
