package com.production.scholar_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    private String jobId;
    private String documentId;
    private String fileName;

    /** pending, processing, complete or failed. */
    private String status;

    private JobState state;
    private List<JobState> history;
    private JobState failedStage;
    private String errorMessage;
    private List<Integer> ocrPages;
    private Instant startTime;
    private Instant endTime;

    /** Where the finished document can be fetched; set once complete. */
    private String documentRef;
}
