package com.production.scholar_service.service;

import com.production.scholar_service.exception.DocumentNotFoundException;
import com.production.scholar_service.exception.IndexWriteException;
import com.production.scholar_service.exception.JobConflictException;
import com.production.scholar_service.lucene.LuceneIndexService;
import com.production.scholar_service.lucene.LuceneSearchService;
import com.production.scholar_service.model.Chunk;
import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.DocumentRecord;
import com.production.scholar_service.model.DocumentStatus;
import com.production.scholar_service.model.DocumentSummary;
import com.production.scholar_service.model.IngestionOptions;
import com.production.scholar_service.model.IngestionResponse.FileSubmission;
import com.production.scholar_service.model.JobState;
import com.production.scholar_service.model.JobStatusResponse;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataPatch;
import com.production.scholar_service.repository.DocumentRecordRepository;
import com.production.scholar_service.service.extraction.ExtractionService;
import com.production.scholar_service.service.job.JobTracker;
import com.production.scholar_service.service.job.ProcessingJob;
import com.production.scholar_service.service.metadata.MetadataReconciler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for everything that starts, inspects or changes document processing.
 *
 * Each uploaded file becomes its own document and its own background job, so one bad file
 * never affects the rest of a batch. Calls return as soon as the work is queued; progress is polled.
 */
@Service
@Slf4j
public class IngestionJobService {

    private final DocumentPipelineService pipelineService;
    private final ExtractionService extractionService;
    private final OriginalFileStore fileStore;
    private final DocumentRecordRepository documentRepository;
    private final JobTracker jobTracker;
    private final MetadataReconciler metadataReconciler;
    private final LuceneIndexService indexService;
    private final LuceneSearchService searchService;
    private final Executor ingestionExecutor;

    public IngestionJobService(DocumentPipelineService pipelineService,
                               ExtractionService extractionService,
                               OriginalFileStore fileStore,
                               DocumentRecordRepository documentRepository,
                               JobTracker jobTracker,
                               MetadataReconciler metadataReconciler,
                               LuceneIndexService indexService,
                               LuceneSearchService searchService,
                               @Qualifier("ingestionExecutor") Executor ingestionExecutor) {
        this.pipelineService = pipelineService;
        this.extractionService = extractionService;
        this.fileStore = fileStore;
        this.documentRepository = documentRepository;
        this.jobTracker = jobTracker;
        this.metadataReconciler = metadataReconciler;
        this.indexService = indexService;
        this.searchService = searchService;
        this.ingestionExecutor = ingestionExecutor;
    }

    /**
     * Runs that were in flight when the service last stopped can never finish; mark them failed
     * so they show up for reprocessing.
     */
    @PostConstruct
    public void recoverInterrupted() {
        List<DocumentRecord> interrupted = documentRepository.findByStatus(DocumentStatus.PROCESSING);
        for (DocumentRecord record : interrupted) {
            record.setStatus(DocumentStatus.FAILED);
            record.setErrorMessage("Processing interrupted by service restart");
            documentRepository.save(record);
        }
        if (!interrupted.isEmpty()) {
            log.warn("Marked {} interrupted document(s) as failed", interrupted.size());
        }
    }

    /**
     * Stores each file and queues it for background processing.
     */
    public List<FileSubmission> ingest(List<PendingFile> files, IngestionOptions options) {
        List<FileSubmission> submissions = new ArrayList<>();
        for (PendingFile pending : files) {
            try {
                DocumentRecord record = createRecord(pending, options);
                ProcessingJob job = jobTracker.register(record.getDocumentId(), record.getFileName());
                jobTracker.beginRun(record.getDocumentId());
                submit(job);
                log.info("[{}] Queued {} as {}", job.getJobId(), pending.originalFileName(), record.getDocumentId());
                submissions.add(FileSubmission.builder()
                        .fileName(pending.originalFileName())
                        .documentId(record.getDocumentId())
                        .jobId(job.getJobId())
                        .status(job.getStatus().external())
                        .build());
            } catch (RuntimeException | IOException e) {
                log.error("Rejected {}: {}", pending.originalFileName(), e.getMessage());
                submissions.add(rejected(pending, e));
            } finally {
                deleteTemp(pending);
            }
        }
        return submissions;
    }

    /**
     * Stores each file and returns reconciled metadata for review. Nothing is queued until
     * {@link #confirmPreview} is called for the document.
     */
    public List<FileSubmission> preview(List<PendingFile> files, IngestionOptions options) {
        List<FileSubmission> submissions = new ArrayList<>();
        for (PendingFile pending : files) {
            try {
                DocumentRecord record = createRecord(pending, options);
                Metadata preview = pipelineService.previewMetadata(
                        Path.of(record.getStoredPath()), record.getFileName(), options);
                record.setMetadata(preview);
                record.setNeedsReview(preview.isNeedsReview());
                documentRepository.save(record);
                submissions.add(FileSubmission.builder()
                        .fileName(pending.originalFileName())
                        .documentId(record.getDocumentId())
                        .status(DocumentStatus.PENDING.external())
                        .preview(preview)
                        .build());
            } catch (RuntimeException | IOException e) {
                log.error("Preview failed for {}: {}", pending.originalFileName(), e.getMessage());
                submissions.add(rejected(pending, e));
            } finally {
                deleteTemp(pending);
            }
        }
        return submissions;
    }

    /**
     * Queues a previewed document, applying the reviewer's corrections first. Corrected fields are
     * kept as manual through processing.
     */
    public FileSubmission confirmPreview(String documentId, MetadataPatch corrections) {
        DocumentRecord record = documentRepository.findByDocumentId(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        if (record.getStatus() != DocumentStatus.PENDING || jobTracker.findByDocument(documentId).isPresent()) {
            throw new JobConflictException(documentId);
        }
        if (corrections != null && !corrections.isEmpty()) {
            Metadata base = record.getMetadata() != null ? record.getMetadata() : new Metadata();
            Metadata corrected = metadataReconciler.applyManual(base, corrections);
            record.setMetadata(corrected);
            record.setNeedsReview(corrected.isNeedsReview());
            documentRepository.save(record);
        }
        jobTracker.beginRun(documentId);
        ProcessingJob job = jobTracker.register(documentId, record.getFileName());
        submit(job);
        log.info("[{}] Preview of {} confirmed", job.getJobId(), documentId);
        return FileSubmission.builder()
                .fileName(record.getFileName())
                .documentId(documentId)
                .jobId(job.getJobId())
                .status(job.getStatus().external())
                .build();
    }

    /**
     * Re-runs the whole pipeline against the stored original. Rejected while another run for the
     * same document is active.
     */
    public JobStatusResponse reprocess(String documentId) {
        DocumentRecord record = documentRepository.findByDocumentId(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        if (!fileStore.exists(record.getStoredPath())) {
            throw new IllegalStateException("Original file for " + documentId + " is no longer stored");
        }

        jobTracker.beginRun(documentId);
        ProcessingJob job;
        try {
            job = jobTracker.findByDocument(documentId).isPresent()
                    ? jobTracker.reset(documentId)
                    : jobTracker.register(documentId, record.getFileName());
        } catch (RuntimeException e) {
            jobTracker.endRun(documentId);
            throw e;
        }
        submit(job);
        log.info("[{}] Reprocessing {} (generation {})", job.getJobId(), documentId, job.getGeneration());
        return toResponse(job);
    }

    public JobStatusResponse status(String id) {
        return jobTracker.find(id)
                .map(this::toResponse)
                .orElseGet(() -> documentRepository.findByDocumentId(id)
                        .map(this::toResponse)
                        .orElseThrow(() -> new DocumentNotFoundException(id)));
    }

    public Metadata updateMetadata(String documentId, MetadataPatch patch) {
        ReentrantLock lock = jobTracker.documentLock(documentId);
        lock.lock();
        try {
            DocumentRecord record = documentRepository.findByDocumentId(documentId)
                    .orElseThrow(() -> new DocumentNotFoundException(documentId));
            Metadata base = record.getMetadata() != null ? record.getMetadata() : new Metadata();
            Metadata updated = metadataReconciler.applyManual(base, patch);
            record.setMetadata(updated);
            record.setNeedsReview(updated.isNeedsReview());
            documentRepository.save(record);
            log.info("Manual metadata update for {}: {}", documentId, patch);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the document, its index entries and its stored original. An in-flight run is cancelled
     * and its results are discarded.
     */
    public void delete(String documentId) {
        boolean known = documentRepository.existsByDocumentId(documentId)
                || jobTracker.findByDocument(documentId).isPresent();
        if (!known) {
            throw new DocumentNotFoundException(documentId);
        }

        jobTracker.cancel(documentId);
        ReentrantLock lock = jobTracker.documentLock(documentId);
        lock.lock();
        try {
            indexService.deleteByDocumentId(documentId);
            documentRepository.findByDocumentId(documentId).ifPresent(documentRepository::delete);
            try {
                fileStore.delete(documentId);
            } catch (IOException e) {
                log.warn("Stored original of {} could not be removed: {}", documentId, e.getMessage());
            }
            jobTracker.forget(documentId);
            log.info("Deleted document {}", documentId);
        } catch (IOException e) {
            throw new IndexWriteException("Failed to delete index entries for " + documentId, e);
        } finally {
            lock.unlock();
        }
    }

    public List<DocumentSummary> listDocuments() {
        return documentRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt")).stream()
                .map(DocumentSummary::from)
                .toList();
    }

    public DocumentSummary getDocument(String documentId) {
        return documentRepository.findByDocumentId(documentId)
                .map(DocumentSummary::from)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    public List<Chunk> getChunks(String documentId) {
        return documentRepository.findByDocumentId(documentId)
                .map(DocumentRecord::getChunks)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    public Map<String, Object> stats() throws IOException {
        Map<String, Object> stats = new LinkedHashMap<>();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (DocumentStatus status : DocumentStatus.values()) {
            byStatus.put(status.external(), documentRepository.countByStatus(status));
        }
        stats.put("documentsByStatus", byStatus);
        stats.put("index", searchService.getChunkStatistics());
        return stats;
    }

    private DocumentRecord createRecord(PendingFile pending, IngestionOptions options) throws IOException {
        DocumentFormat format = extractionService.detectFormat(pending.tempPath(), pending.originalFileName());
        String documentId = UUID.randomUUID().toString();
        Path stored = fileStore.store(documentId, pending.originalFileName(), pending.tempPath(), pending.deleteAfter());

        DocumentRecord record = DocumentRecord.builder()
                .documentId(documentId)
                .fileName(pending.originalFileName())
                .storedPath(stored.toString())
                .format(format)
                .status(DocumentStatus.PENDING)
                .options(options)
                .fileSizeBytes(Files.size(stored))
                .build();
        return documentRepository.save(record);
    }

    private void submit(ProcessingJob job) {
        String documentId = job.getDocumentId();
        try {
            ingestionExecutor.execute(() -> {
                try {
                    pipelineService.process(job);
                } finally {
                    jobTracker.endRun(documentId);
                }
            });
        } catch (RejectedExecutionException e) {
            jobTracker.fail(job, JobState.QUEUED, "Ingestion queue is full");
            jobTracker.endRun(documentId);
            documentRepository.findByDocumentId(documentId).ifPresent(record -> {
                record.setStatus(DocumentStatus.FAILED);
                record.setErrorStage(JobState.QUEUED.name());
                record.setErrorMessage("Ingestion queue is full");
                documentRepository.save(record);
            });
        }
    }

    private JobStatusResponse toResponse(ProcessingJob job) {
        return JobStatusResponse.builder()
                .jobId(job.getJobId())
                .documentId(job.getDocumentId())
                .fileName(job.getFileName())
                .status(job.getStatus().external())
                .state(job.getState())
                .history(job.getHistory())
                .failedStage(job.getFailedStage())
                .errorMessage(job.getErrorMessage())
                .ocrPages(job.getOcrPages())
                .startTime(job.getStartTime())
                .endTime(job.getEndTime())
                .documentRef(job.getState() == JobState.COMPLETE ? documentRef(job.getDocumentId()) : null)
                .build();
    }

    private JobStatusResponse toResponse(DocumentRecord record) {
        return JobStatusResponse.builder()
                .documentId(record.getDocumentId())
                .fileName(record.getFileName())
                .status(record.getStatus().external())
                .errorMessage(record.getErrorMessage())
                .ocrPages(record.getOcrPages())
                .documentRef(record.getStatus() == DocumentStatus.COMPLETE ? documentRef(record.getDocumentId()) : null)
                .build();
    }

    private static String documentRef(String documentId) {
        return "/api/v1/documents/" + documentId;
    }

    private static FileSubmission rejected(PendingFile pending, Exception e) {
        return FileSubmission.builder()
                .fileName(pending.originalFileName())
                .status(DocumentStatus.FAILED.external())
                .error(e.getMessage())
                .build();
    }

    private static void deleteTemp(PendingFile pending) {
        if (!pending.deleteAfter()) {
            return;
        }
        try {
            Files.deleteIfExists(pending.tempPath());
        } catch (IOException e) {
            log.debug("Temp file {} not removed: {}", pending.tempPath(), e.getMessage());
        }
    }

    /**
     * A file saved to a temp path, ready for background processing.
     * Created by the controller before the HTTP request completes.
     */
    public record PendingFile(Path tempPath, String originalFileName, boolean deleteAfter) {
        public PendingFile(Path tempPath, String originalFileName) {
            this(tempPath, originalFileName, true);
        }
    }
}
