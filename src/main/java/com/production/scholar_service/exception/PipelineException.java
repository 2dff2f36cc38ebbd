package com.production.scholar_service.exception;

import com.production.scholar_service.model.JobState;
import lombok.Getter;

/**
 * Failure of one pipeline stage for one document. Carries the stage so the job can report where it stopped.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final JobState stage;

    public PipelineException(JobState stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(JobState stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
