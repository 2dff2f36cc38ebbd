package com.production.scholar_service.service.job;

import com.production.scholar_service.exception.JobCancelledException;
import com.production.scholar_service.exception.JobConflictException;
import com.production.scholar_service.model.JobState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single source of truth for job progress.
 *
 * One job per document. States only move forward; the only way back to QUEUED is
 * {@link #reset(String)}, used by reprocessing. At most one run per document is active at a time.
 */
@Service
@Slf4j
public class JobTracker {

    private final ConcurrentHashMap<String, ProcessingJob> jobsById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> jobIdByDocument = new ConcurrentHashMap<>();
    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, ReentrantLock> documentLocks = new ConcurrentHashMap<>();

    public ProcessingJob register(String documentId, String fileName) {
        String jobId = "job_" + UUID.randomUUID().toString().substring(0, 12);
        ProcessingJob job = new ProcessingJob(jobId, documentId, fileName);
        jobsById.put(jobId, job);
        String previous = jobIdByDocument.put(documentId, jobId);
        if (previous != null) {
            jobsById.remove(previous);
        }
        log.debug("[{}] Registered job for document {} ({})", jobId, documentId, fileName);
        return job;
    }

    public Optional<ProcessingJob> find(String id) {
        ProcessingJob job = jobsById.get(id);
        if (job != null) {
            return Optional.of(job);
        }
        String jobId = jobIdByDocument.get(id);
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobsById.get(jobId));
    }

    public Optional<ProcessingJob> findByDocument(String documentId) {
        String jobId = jobIdByDocument.get(documentId);
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobsById.get(jobId));
    }

    public List<ProcessingJob> all() {
        return List.copyOf(jobsById.values());
    }

    /**
     * Moves the job strictly forward.
     *
     * @throws IllegalStateException if the transition would revisit or skip backwards
     * @throws JobCancelledException if the job was cancelled since the last stage
     */
    public void advance(ProcessingJob job, JobState next) {
        synchronized (job) {
            checkNotCancelled(job);
            if (!job.getState().canAdvanceTo(next) || next == JobState.FAILED) {
                throw new IllegalStateException("Illegal transition " + job.getState() + " -> " + next
                        + " for job " + job.getJobId());
            }
            job.moveTo(next);
        }
        log.debug("[{}] {} -> {}", job.getJobId(), job.getDocumentId(), next);
    }

    public void complete(ProcessingJob job) {
        advance(job, JobState.COMPLETE);
        log.info("[{}] Document {} complete", job.getJobId(), job.getDocumentId());
    }

    public void fail(ProcessingJob job, JobState stage, String detail) {
        synchronized (job) {
            if (job.getState().isTerminal()) {
                log.warn("[{}] Ignoring failure after terminal state {}: {}", job.getJobId(), job.getState(), detail);
                return;
            }
            job.recordFailure(stage, detail);
            job.moveTo(JobState.FAILED);
        }
        log.error("[{}] Document {} failed at {}: {}", job.getJobId(), job.getDocumentId(), stage, detail);
    }

    public void recordOcrPages(ProcessingJob job, List<Integer> pages) {
        job.recordOcrPages(pages);
    }

    /**
     * Puts a finished job back to QUEUED for reprocessing.
     *
     * @throws IllegalStateException if the job is still running
     */
    public ProcessingJob reset(String documentId) {
        ProcessingJob job = findByDocument(documentId)
                .orElseThrow(() -> new IllegalStateException("No job known for document " + documentId));
        synchronized (job) {
            if (!job.getState().isTerminal()) {
                throw new JobConflictException(documentId);
            }
            job.restart();
        }
        log.info("[{}] Document {} reset for reprocessing (generation {})",
                job.getJobId(), documentId, job.getGeneration());
        return job;
    }

    /**
     * Claims the single active-run slot of a document.
     *
     * @throws JobConflictException if another run holds it
     */
    public void beginRun(String documentId) {
        if (!activeRuns.add(documentId)) {
            throw new JobConflictException(documentId);
        }
    }

    public void endRun(String documentId) {
        activeRuns.remove(documentId);
    }

    public boolean isRunning(String documentId) {
        return activeRuns.contains(documentId);
    }

    /**
     * Cooperative: the running job notices at its next stage boundary or before publishing.
     */
    public void cancel(String documentId) {
        findByDocument(documentId).ifPresent(job -> {
            job.cancel();
            log.info("[{}] Cancellation requested for document {}", job.getJobId(), documentId);
        });
    }

    public void forget(String documentId) {
        String jobId = jobIdByDocument.remove(documentId);
        if (jobId != null) {
            jobsById.remove(jobId);
        }
        documentLocks.remove(documentId);
    }

    /**
     * Serializes publishing a run's results against deleting the same document.
     */
    public ReentrantLock documentLock(String documentId) {
        return documentLocks.computeIfAbsent(documentId, id -> new ReentrantLock());
    }

    public void checkNotCancelled(ProcessingJob job) {
        if (job.isCancelled()) {
            throw new JobCancelledException(job.getDocumentId());
        }
    }
}
