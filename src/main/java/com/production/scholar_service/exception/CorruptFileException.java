package com.production.scholar_service.exception;

import com.production.scholar_service.model.JobState;

public class CorruptFileException extends PipelineException {

    public CorruptFileException(String message) {
        super(JobState.EXTRACTING, message);
    }

    public CorruptFileException(String message, Throwable cause) {
        super(JobState.EXTRACTING, message, cause);
    }
}
