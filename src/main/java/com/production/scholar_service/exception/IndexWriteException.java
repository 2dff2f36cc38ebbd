package com.production.scholar_service.exception;

import com.production.scholar_service.model.JobState;

/** The chunk/index swap could not be published; nothing from the run is visible. */
public class IndexWriteException extends PipelineException {

    public IndexWriteException(String message) {
        super(JobState.EMBEDDING, message);
    }

    public IndexWriteException(String message, Throwable cause) {
        super(JobState.EMBEDDING, message, cause);
    }
}
