package com.production.scholar_service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    /**
     * Runs one document through the pipeline per task. Files of a batch are
     * submitted individually so a slow or failing file never holds up the others.
     */
    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor(IngestionConfig ingestionConfig) {
        int threads = ingestionConfig.resolveThreadCount();
        int queue = ingestionConfig.getQueueCapacity();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix("ingest-job-");
        executor.setRejectedExecutionHandler((runnable, pool) -> {
            log.warn("Ingestion task rejected - queue full. Max concurrent: {}, queue: {}", threads, queue);
            throw new RejectedExecutionException("Ingestion queue is full");
        });
        executor.initialize();
        log.info("Initialized ingestion executor: corePool={}, maxPool={}, queue={}", threads, threads, queue);
        return executor;
    }

    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor(AppConfig appConfig) {
        int threads = Math.max(1, appConfig.getExtraction().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("extract-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        log.info("Initialized extraction executor: threads={}", threads);
        return executor;
    }

    /**
     * Source lookups of every document in flight. Every worker can query all enabled sources at once,
     * and there is no queue: a lookup starts immediately or is rejected.
     */
    @Bean(name = "metadataExecutor")
    public ThreadPoolTaskExecutor metadataExecutor(AppConfig appConfig, IngestionConfig ingestionConfig) {
        int sources = Math.max(1, appConfig.getMetadata().getEnabledSources().size());
        int threads = Math.max(appConfig.getMetadata().getThreads(), ingestionConfig.resolveThreadCount() * sources);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, appConfig.getMetadata().getThreads()));
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("metadata-");
        executor.initialize();
        log.info("Initialized metadata executor: corePool={}, maxPool={}, queue=0", executor.getCorePoolSize(), threads);
        return executor;
    }
}
