package com.production.scholar_service.model;

/**
 * Pipeline stages in the order a job passes through them.
 * OCR is optional; every other non-terminal state is visited on a successful run.
 */
public enum JobState {
    QUEUED,
    EXTRACTING,
    OCR,
    HARVESTING_METADATA,
    RECONCILING,
    SEGMENTING,
    EMBEDDING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean canAdvanceTo(JobState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }

    public DocumentStatus toStatus() {
        switch (this) {
            case QUEUED:
                return DocumentStatus.PENDING;
            case COMPLETE:
                return DocumentStatus.COMPLETE;
            case FAILED:
                return DocumentStatus.FAILED;
            default:
                return DocumentStatus.PROCESSING;
        }
    }
}
