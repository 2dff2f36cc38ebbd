package com.production.scholar_service.service.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.production.scholar_service.model.DocumentStatus;
import com.production.scholar_service.model.JobState;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Progress of one document through the pipeline. Mutated only through JobTracker.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessingJob {

    private final String jobId;
    private final String documentId;
    private final String fileName;
    private volatile JobState state;
    private volatile int generation;
    private volatile JobState failedStage;
    private volatile String errorMessage;
    private volatile List<Integer> ocrPages = List.of();
    private volatile Instant startTime;
    private volatile Instant endTime;
    private final List<JobState> history = Collections.synchronizedList(new ArrayList<>());

    @JsonIgnore
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ProcessingJob(String jobId, String documentId, String fileName) {
        this.jobId = jobId;
        this.documentId = documentId;
        this.fileName = fileName;
        this.state = JobState.QUEUED;
        this.startTime = Instant.now();
        this.history.add(JobState.QUEUED);
    }

    public DocumentStatus getStatus() {
        return state.toStatus();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public List<JobState> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    void moveTo(JobState next) {
        this.state = next;
        this.history.add(next);
        if (next.isTerminal()) {
            this.endTime = Instant.now();
        }
    }

    void recordFailure(JobState stage, String message) {
        this.failedStage = stage;
        this.errorMessage = message;
    }

    void recordOcrPages(List<Integer> pages) {
        this.ocrPages = List.copyOf(pages);
    }

    void restart() {
        this.generation++;
        this.state = JobState.QUEUED;
        this.failedStage = null;
        this.errorMessage = null;
        this.ocrPages = List.of();
        this.startTime = Instant.now();
        this.endTime = null;
        this.cancelled.set(false);
        synchronized (history) {
            history.clear();
            history.add(JobState.QUEUED);
        }
    }

    void cancel() {
        cancelled.set(true);
    }
}
