package com.production.scholar_service.service;

import com.production.scholar_service.exception.DocumentNotFoundException;
import com.production.scholar_service.exception.IndexWriteException;
import com.production.scholar_service.exception.JobCancelledException;
import com.production.scholar_service.exception.PipelineException;
import com.production.scholar_service.lucene.IndexedChunk;
import com.production.scholar_service.lucene.LuceneIndexService;
import com.production.scholar_service.model.Chunk;
import com.production.scholar_service.model.DocumentRecord;
import com.production.scholar_service.model.DocumentStatus;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.IngestionOptions;
import com.production.scholar_service.model.JobState;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.PageContent;
import com.production.scholar_service.repository.DocumentRecordRepository;
import com.production.scholar_service.service.embedding.ChunkEmbedder;
import com.production.scholar_service.service.extraction.ExtractionService;
import com.production.scholar_service.service.job.JobTracker;
import com.production.scholar_service.service.job.ProcessingJob;
import com.production.scholar_service.service.metadata.HarvestResult;
import com.production.scholar_service.service.metadata.LocalMetadataExtractor;
import com.production.scholar_service.service.metadata.MetadataHarvester;
import com.production.scholar_service.service.metadata.MetadataReconciler;
import com.production.scholar_service.service.ocr.OcrFallbackService;
import com.production.scholar_service.service.segment.Segmenter;
import com.production.scholar_service.service.segment.TextCleaningService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs one document through every stage:
 * extract, OCR when needed, harvest, reconcile, segment, embed, publish.
 *
 * Nothing becomes visible until publish, which swaps the document's index entries and
 * store record together. A failure at any stage leaves the previously published state intact.
 */
@Service
@Slf4j
public class DocumentPipelineService {

    /** Extra attribute listing the pages whose text came from OCR. */
    public static final String OCR_EXTRA = "ocr";

    private final ExtractionService extractionService;
    private final OcrFallbackService ocrFallbackService;
    private final TextCleaningService textCleaningService;
    private final LocalMetadataExtractor localMetadataExtractor;
    private final MetadataHarvester metadataHarvester;
    private final MetadataReconciler metadataReconciler;
    private final Segmenter segmenter;
    private final ChunkEmbedder chunkEmbedder;
    private final LuceneIndexService indexService;
    private final DocumentRecordRepository documentRepository;
    private final JobTracker jobTracker;

    public DocumentPipelineService(ExtractionService extractionService,
                                   OcrFallbackService ocrFallbackService,
                                   TextCleaningService textCleaningService,
                                   LocalMetadataExtractor localMetadataExtractor,
                                   MetadataHarvester metadataHarvester,
                                   MetadataReconciler metadataReconciler,
                                   Segmenter segmenter,
                                   ChunkEmbedder chunkEmbedder,
                                   LuceneIndexService indexService,
                                   DocumentRecordRepository documentRepository,
                                   JobTracker jobTracker) {
        this.extractionService = extractionService;
        this.ocrFallbackService = ocrFallbackService;
        this.textCleaningService = textCleaningService;
        this.localMetadataExtractor = localMetadataExtractor;
        this.metadataHarvester = metadataHarvester;
        this.metadataReconciler = metadataReconciler;
        this.segmenter = segmenter;
        this.chunkEmbedder = chunkEmbedder;
        this.indexService = indexService;
        this.documentRepository = documentRepository;
        this.jobTracker = jobTracker;
    }

    /**
     * Processes the document behind {@code job}. Failures end the job in FAILED and are not rethrown.
     */
    public void process(ProcessingJob job) {
        String jobId = job.getJobId();
        String documentId = job.getDocumentId();
        long start = System.currentTimeMillis();

        try {
            DocumentRecord record = markProcessing(job);
            IngestionOptions options = record.getOptions() != null ? record.getOptions() : IngestionOptions.defaults();
            Path original = Paths.get(record.getStoredPath());

            jobTracker.advance(job, JobState.EXTRACTING);
            ExtractedContent content = extractionService.extract(original, record.getFileName());
            log.info("[{}] Extracted {}: {} pages", jobId, record.getFileName(), content.getPageCount());

            List<Integer> ocrPages = runOcrIfNeeded(job, content, original, options);

            Metadata local = localMetadataExtractor.extract(content);
            cleanPages(content);

            jobTracker.advance(job, JobState.HARVESTING_METADATA);
            HarvestResult harvest = options.isHarvestMetadata()
                    ? metadataHarvester.harvest(local, options.getSources())
                    : HarvestResult.empty();

            jobTracker.advance(job, JobState.RECONCILING);
            Metadata metadata = metadataReconciler.reconcile(harvest.candidates(), local);

            jobTracker.advance(job, JobState.SEGMENTING);
            long segmentStart = System.currentTimeMillis();
            List<Chunk> chunks = segmenter.segment(content.getPages(), documentId);
            log.info("[TIMING] [{}] Segmentation: {} chunks in {}ms", jobId, chunks.size(),
                    System.currentTimeMillis() - segmentStart);

            jobTracker.advance(job, JobState.EMBEDDING);
            List<IndexedChunk> embedded = chunkEmbedder.embed(chunks);

            publish(job, content, metadata, chunks, embedded, ocrPages);
            jobTracker.complete(job);

            log.info("[{}] Done: {} -> {} chunks, metadata from {} in {}ms", jobId, record.getFileName(),
                    chunks.size(), metadata.getProvenance().values().stream()
                            .map(p -> p.source()).distinct().sorted().collect(Collectors.toList()),
                    System.currentTimeMillis() - start);

        } catch (JobCancelledException e) {
            log.info("[{}] Run for {} cancelled, results discarded", jobId, documentId);
        } catch (PipelineException e) {
            fail(job, e.getStage(), e.getMessage());
        } catch (DocumentNotFoundException e) {
            fail(job, job.getState(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error processing {}", jobId, documentId, e);
            fail(job, job.getState(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Local metadata plus a harvest, without segmenting or indexing. Used for the review step before
     * a document is committed to processing.
     */
    public Metadata previewMetadata(Path original, String fileName, IngestionOptions options) {
        ExtractedContent content = extractionService.extract(original, fileName);
        if (options.isOcrEnabled() && ocrFallbackService.needsOcr(content)) {
            try {
                ocrFallbackService.apply(content, original, options.getLanguageHint());
            } catch (IOException e) {
                log.warn("OCR skipped for preview of {}: {}", fileName, e.getMessage());
            }
        }
        Metadata local = localMetadataExtractor.extract(content);
        HarvestResult harvest = options.isHarvestMetadata()
                ? metadataHarvester.harvest(local, options.getSources())
                : HarvestResult.empty();
        return metadataReconciler.reconcile(harvest.candidates(), local);
    }

    private List<Integer> runOcrIfNeeded(ProcessingJob job, ExtractedContent content, Path original,
                                         IngestionOptions options) {
        if (!options.isOcrEnabled() || !ocrFallbackService.needsOcr(content)) {
            return List.of();
        }
        jobTracker.advance(job, JobState.OCR);
        try {
            List<Integer> pages = ocrFallbackService.apply(content, original, options.getLanguageHint());
            jobTracker.recordOcrPages(job, pages);
            return pages;
        } catch (IOException e) {
            log.warn("[{}] OCR skipped, pages could not be rendered: {}", job.getJobId(), e.getMessage());
            return List.of();
        }
    }

    private void cleanPages(ExtractedContent content) {
        for (PageContent page : content.getPages()) {
            page.setCleanedText(textCleaningService.fullClean(page.getRawText()));
        }
    }

    /**
     * Swaps in the new chunk set and record under the document lock. The index goes first; if the
     * record cannot be saved afterwards, the previous index entries are restored.
     */
    private void publish(ProcessingJob job, ExtractedContent content, Metadata metadata,
                         List<Chunk> chunks, List<IndexedChunk> embedded, List<Integer> ocrPages) {
        String documentId = job.getDocumentId();
        ReentrantLock lock = jobTracker.documentLock(documentId);
        lock.lock();
        try {
            jobTracker.checkNotCancelled(job);
            DocumentRecord record = documentRepository.findByDocumentId(documentId)
                    .orElseThrow(() -> new JobCancelledException(documentId));

            Metadata finalMetadata = metadataReconciler.retainManual(metadata, record.getMetadata());
            if (finalMetadata.getExtra() == null) {
                finalMetadata.setExtra(new TreeMap<>());
            }
            if (ocrPages.isEmpty()) {
                finalMetadata.getExtra().remove(OCR_EXTRA);
            } else {
                finalMetadata.getExtra().put(OCR_EXTRA, new ArrayList<>(ocrPages));
            }

            List<IndexedChunk> previous;
            try {
                previous = indexService.snapshot(documentId);
                indexService.replaceDocument(documentId, embedded);
            } catch (IOException | RuntimeException e) {
                throw new IndexWriteException("Index update failed for " + documentId + ": " + e.getMessage(), e);
            }

            try {
                record.setMetadata(finalMetadata);
                record.setNeedsReview(finalMetadata.isNeedsReview());
                record.setChunks(new ArrayList<>(chunks));
                record.setRawText(rawText(content));
                record.setOcrPages(new ArrayList<>(ocrPages));
                record.setStatus(DocumentStatus.COMPLETE);
                record.setErrorStage(null);
                record.setErrorMessage(null);
                record.setProcessedAt(LocalDateTime.now());
                documentRepository.save(record);
            } catch (RuntimeException e) {
                restore(documentId, previous);
                throw new IndexWriteException("Store update failed for " + documentId + ": " + e.getMessage(), e);
            }
            log.info("[{}] Published {} chunks for {}", job.getJobId(), chunks.size(), documentId);
        } finally {
            lock.unlock();
        }
    }

    private void restore(String documentId, List<IndexedChunk> previous) {
        try {
            indexService.replaceDocument(documentId, previous);
            log.warn("Restored {} previous index entries for {}", previous.size(), documentId);
        } catch (IOException e) {
            log.error("Could not restore index entries for {}; reprocess the document", documentId, e);
        }
    }

    /**
     * Loads the record and flags it PROCESSING under the document lock, so a concurrent delete either
     * finishes first and cancels this run or waits until the flag is written.
     */
    private DocumentRecord markProcessing(ProcessingJob job) {
        String documentId = job.getDocumentId();
        ReentrantLock lock = jobTracker.documentLock(documentId);
        lock.lock();
        try {
            jobTracker.checkNotCancelled(job);
            DocumentRecord record = documentRepository.findByDocumentId(documentId)
                    .orElseThrow(() -> new DocumentNotFoundException(documentId));
            record.setStatus(DocumentStatus.PROCESSING);
            record.setErrorStage(null);
            record.setErrorMessage(null);
            documentRepository.save(record);
            return record;
        } finally {
            lock.unlock();
        }
    }

    private void fail(ProcessingJob job, JobState stage, String detail) {
        jobTracker.fail(job, stage, detail);
        ReentrantLock lock = jobTracker.documentLock(job.getDocumentId());
        lock.lock();
        try {
            if (job.isCancelled()) {
                return;
            }
            documentRepository.findByDocumentId(job.getDocumentId()).ifPresent(record -> {
                // a document that was published before keeps serving its last good chunks
                record.setStatus(DocumentStatus.FAILED);
                record.setErrorStage(stage != null ? stage.name() : null);
                record.setErrorMessage(truncate(detail, 2000));
                documentRepository.save(record);
            });
        } catch (RuntimeException e) {
            log.error("[{}] Could not record failure for {}", job.getJobId(), job.getDocumentId(), e);
        } finally {
            lock.unlock();
        }
    }

    private static String rawText(ExtractedContent content) {
        return content.getPages().stream()
                .map(PageContent::getRawText)
                .filter(t -> t != null && !t.isBlank())
                .collect(Collectors.joining("\n\n"));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) return null;
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
