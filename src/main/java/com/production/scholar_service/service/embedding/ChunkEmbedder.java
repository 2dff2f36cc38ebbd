package com.production.scholar_service.service.embedding;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.EmbeddingException;
import com.production.scholar_service.lucene.IndexedChunk;
import com.production.scholar_service.model.Chunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Vectorizes chunks in batches. Transient model failures are retried with exponential backoff;
 * a wrong vector size or an exhausted retry budget raises {@link EmbeddingException}.
 */
@Service
@Slf4j
public class ChunkEmbedder {

    private final EmbeddingModel embeddingModel;
    private final AppConfig appConfig;

    public ChunkEmbedder(EmbeddingModel embeddingModel, AppConfig appConfig) {
        this.embeddingModel = embeddingModel;
        this.appConfig = appConfig;
    }

    public List<IndexedChunk> embed(List<Chunk> chunks) {
        long start = System.currentTimeMillis();
        int batchSize = Math.max(1, appConfig.getEmbedding().getBatchSize());
        List<IndexedChunk> embedded = new ArrayList<>(chunks.size());

        for (int from = 0; from < chunks.size(); from += batchSize) {
            List<Chunk> batch = chunks.subList(from, Math.min(chunks.size(), from + batchSize));
            List<TextSegment> segments = batch.stream().map(c -> TextSegment.from(c.getContent())).toList();
            List<Embedding> embeddings = withRetry("batch at chunk " + from,
                    () -> embeddingModel.embedAll(segments).content());
            if (embeddings == null || embeddings.size() != batch.size()) {
                throw new EmbeddingException("Embedding model returned "
                        + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + batch.size() + " chunks");
            }
            for (int i = 0; i < batch.size(); i++) {
                embedded.add(new IndexedChunk(batch.get(i), checkDimensions(embeddings.get(i).vector())));
            }
        }

        log.info("[TIMING] Embedded {} chunks in {}ms", chunks.size(), System.currentTimeMillis() - start);
        return embedded;
    }

    public float[] embedQuery(String text) {
        Embedding embedding = withRetry("query", () -> embeddingModel.embed(text).content());
        return checkDimensions(embedding.vector());
    }

    private float[] checkDimensions(float[] vector) {
        int expected = appConfig.getEmbedding().getDimensions();
        if (vector == null || vector.length != expected) {
            throw new EmbeddingException("Expected " + expected + "-dimensional embeddings but got "
                    + (vector == null ? "none" : vector.length));
        }
        return vector;
    }

    private <T> T withRetry(String what, Supplier<T> call) {
        var config = appConfig.getEmbedding();
        int maxRetries = config.getMaxRetries();
        RuntimeException lastException = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                long backoffMs = (long) Math.pow(2, attempt - 1) * config.getRetryBaseDelayMs();
                log.warn("Embedding retry {}/{} for {} - waiting {}ms", attempt, maxRetries, what, backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EmbeddingException("Interrupted while embedding " + what, e);
                }
            }
            try {
                return call.get();
            } catch (EmbeddingException e) {
                throw e;
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("Embedding {} failed: {}", what, e.getMessage());
            }
        }
        throw new EmbeddingException("Embedding " + what + " failed after " + (maxRetries + 1) + " attempts", lastException);
    }
}
