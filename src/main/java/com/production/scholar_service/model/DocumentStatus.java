package com.production.scholar_service.model;

/**
 * Status of a document as seen by callers polling for progress.
 */
public enum DocumentStatus {
    PENDING,
    PROCESSING,
    COMPLETE,
    FAILED;

    public String external() {
        return name().toLowerCase();
    }
}
