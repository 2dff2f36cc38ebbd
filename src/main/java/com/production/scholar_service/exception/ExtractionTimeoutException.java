package com.production.scholar_service.exception;

import com.production.scholar_service.model.JobState;

public class ExtractionTimeoutException extends PipelineException {

    public ExtractionTimeoutException(String message) {
        super(JobState.EXTRACTING, message);
    }

    public ExtractionTimeoutException(String message, Throwable cause) {
        super(JobState.EXTRACTING, message, cause);
    }
}
