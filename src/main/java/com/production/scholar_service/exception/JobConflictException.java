package com.production.scholar_service.exception;

/**
 * A run for the same document is already in flight.
 */
public class JobConflictException extends RuntimeException {

    public JobConflictException(String documentId) {
        super("A processing run is already active for document " + documentId);
    }
}
