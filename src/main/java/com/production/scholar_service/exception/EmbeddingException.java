package com.production.scholar_service.exception;

import com.production.scholar_service.model.JobState;

/** Raised once the embedding retry budget is exhausted. */
public class EmbeddingException extends PipelineException {

    public EmbeddingException(String message) {
        super(JobState.EMBEDDING, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(JobState.EMBEDDING, message, cause);
    }
}
