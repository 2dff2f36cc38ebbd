package com.production.scholar_service.exception;

/**
 * The document was deleted or superseded while its job was running.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String documentId) {
        super("Processing cancelled for document " + documentId);
    }
}
