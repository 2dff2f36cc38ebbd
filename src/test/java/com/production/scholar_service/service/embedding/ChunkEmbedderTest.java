package com.production.scholar_service.service.embedding;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.EmbeddingException;
import com.production.scholar_service.lucene.IndexedChunk;
import com.production.scholar_service.model.Chunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ChunkEmbedderTest {

    private AppConfig appConfig;

    @BeforeEach
    void setUp() {
        appConfig = new AppConfig();
        appConfig.getEmbedding().setDimensions(3);
        appConfig.getEmbedding().setBatchSize(2);
        appConfig.getEmbedding().setMaxRetries(3);
        appConfig.getEmbedding().setRetryBaseDelayMs(1);
    }

    @Test
    @DisplayName("should embed chunks in batches and keep their order")
    void shouldEmbedInBatches() {
        FakeEmbeddingModel model = new FakeEmbeddingModel(3, 0);
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            chunks.add(Chunk.builder().chunkId("d_c" + i).documentId("d").chunkIndex(i).content("text " + i).build());
        }

        List<IndexedChunk> embedded = new ChunkEmbedder(model, appConfig).embed(chunks);

        assertEquals(5, embedded.size());
        assertEquals(3, model.calls.get());
        assertEquals("d_c4", embedded.get(4).chunk().getChunkId());
        assertEquals("text 4".length(), embedded.get(4).vector()[0], 1e-6);
    }

    @Test
    @DisplayName("should retry transient failures")
    void shouldRetry() {
        FakeEmbeddingModel model = new FakeEmbeddingModel(3, 2);

        float[] vector = new ChunkEmbedder(model, appConfig).embedQuery("query");

        assertEquals(3, vector.length);
        assertEquals(3, model.calls.get());
    }

    @Test
    @DisplayName("should give up once the retry budget is spent")
    void shouldGiveUp() {
        FakeEmbeddingModel model = new FakeEmbeddingModel(3, Integer.MAX_VALUE);

        EmbeddingException e = assertThrows(EmbeddingException.class,
                () -> new ChunkEmbedder(model, appConfig).embedQuery("query"));

        assertEquals(4, model.calls.get());
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("should reject vectors of the wrong size without retrying")
    void shouldCheckDimensions() {
        FakeEmbeddingModel model = new FakeEmbeddingModel(5, 0);

        assertThrows(EmbeddingException.class, () -> new ChunkEmbedder(model, appConfig).embedQuery("query"));
        assertEquals(1, model.calls.get());
    }

    /** Vectors start with the text length; the first {@code failures} calls throw. */
    private static final class FakeEmbeddingModel implements EmbeddingModel {

        private final int dimensions;
        private final int failures;
        private final AtomicInteger calls = new AtomicInteger();

        FakeEmbeddingModel(int dimensions, int failures) {
            this.dimensions = dimensions;
            this.failures = failures;
        }

        @Override
        public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
            if (calls.incrementAndGet() <= failures) {
                throw new RuntimeException("model overloaded");
            }
            List<Embedding> embeddings = new ArrayList<>();
            for (TextSegment segment : segments) {
                float[] vector = new float[dimensions];
                vector[0] = segment.text().length();
                vector[dimensions - 1] += 1f;
                embeddings.add(Embedding.from(vector));
            }
            return Response.from(embeddings);
        }
    }
}
