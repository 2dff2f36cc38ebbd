package com.production.scholar_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResponse {
    private IngestionStatus status;
    private String message;
    private int filesSubmitted;
    private List<FileSubmission> files;

    /**
     * Outcome of one uploaded file. Either a job to poll, a metadata preview awaiting confirmation, or an error.
     */
    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FileSubmission {
        private String fileName;
        private String documentId;
        private String jobId;
        private String status;
        private String error;
        private Metadata preview;

        public boolean isAccepted() {
            return error == null;
        }
    }
}
