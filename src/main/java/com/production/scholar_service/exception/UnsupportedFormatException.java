package com.production.scholar_service.exception;

import com.production.scholar_service.model.JobState;

public class UnsupportedFormatException extends PipelineException {

    public UnsupportedFormatException(String message) {
        super(JobState.EXTRACTING, message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(JobState.EXTRACTING, message, cause);
    }
}
