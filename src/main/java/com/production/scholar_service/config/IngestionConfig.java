package com.production.scholar_service.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizing of the document worker pool. Each worker runs one document end to end, including OCR
 * page rendering, so the pool is capped by {@link #maxThreads} regardless of core count.
 */
@Component
@ConfigurationProperties(prefix = "ingestion")
@Data
@Slf4j
public class IngestionConfig {

    /** "auto" or a positive number. Auto is max(2, cores - 2), capped at maxThreads. */
    private String threads = "auto";

    private int maxThreads = 8;

    /** Documents waiting for a worker before new submissions are rejected. */
    private int queueCapacity = 100;

    public int resolveThreadCount() {
        Integer configured = configuredThreads();
        if (configured != null) {
            log.info("Document workers: {} (configured)", configured);
            return configured;
        }
        int cores = Runtime.getRuntime().availableProcessors();
        int workers = Math.min(Math.max(1, maxThreads), Math.max(2, cores - 2));
        log.info("Document workers: {} ({} cores, cap {})", workers, cores, maxThreads);
        return workers;
    }

    private Integer configuredThreads() {
        if (threads == null || "auto".equalsIgnoreCase(threads.trim())) {
            return null;
        }
        try {
            int value = Integer.parseInt(threads.trim());
            if (value > 0) {
                return value;
            }
            log.warn("ingestion.threads must be positive, got {}; using auto", value);
        } catch (NumberFormatException e) {
            log.warn("ingestion.threads '{}' is not a number; using auto", threads);
        }
        return null;
    }
}
