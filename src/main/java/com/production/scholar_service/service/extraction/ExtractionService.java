package com.production.scholar_service.service.extraction;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.CorruptFileException;
import com.production.scholar_service.exception.ExtractionTimeoutException;
import com.production.scholar_service.exception.PipelineException;
import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.JobState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs format extraction with a hard time limit and maps failures onto the pipeline error taxonomy.
 */
@Service
@Slf4j
public class ExtractionService {

    private final DocumentExtractorRegistry registry;
    private final AsyncTaskExecutor extractionExecutor;
    private final AppConfig appConfig;

    public ExtractionService(DocumentExtractorRegistry registry,
                             @Qualifier("extractionExecutor") AsyncTaskExecutor extractionExecutor,
                             AppConfig appConfig) {
        this.registry = registry;
        this.extractionExecutor = extractionExecutor;
        this.appConfig = appConfig;
    }

    public DocumentFormat detectFormat(Path file, String fileName) {
        return registry.detectFormat(file, fileName);
    }

    public ExtractedContent extract(Path file, String fileName) {
        DocumentFormat format = registry.detectFormat(file, fileName);
        DocumentExtractor extractor = registry.extractorFor(format);
        int timeoutSeconds = appConfig.getExtraction().getTimeoutSeconds();

        long start = System.currentTimeMillis();
        Future<ExtractedContent> future = extractionExecutor.submit(() -> extractor.extract(file));
        try {
            ExtractedContent content = future.get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[TIMING] {} - extract ({}): {}ms ({} pages)",
                    fileName, format, System.currentTimeMillis() - start, content.getPages().size());
            return content;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionTimeoutException(
                    "Extraction of " + fileName + " exceeded " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pipelineException) {
                throw pipelineException;
            }
            if (cause instanceof IOException) {
                throw new CorruptFileException("Cannot read " + fileName + " as " + format + ": "
                        + cause.getMessage(), cause);
            }
            throw new CorruptFileException("Extraction of " + fileName + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineException(JobState.EXTRACTING, "Interrupted while extracting " + fileName, e);
        }
    }
}
