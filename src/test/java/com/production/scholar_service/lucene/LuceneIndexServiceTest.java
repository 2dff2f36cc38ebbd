package com.production.scholar_service.lucene;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.scholar_service.model.Chunk;
import com.production.scholar_service.model.SearchResult;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class LuceneIndexServiceTest {

    private Directory directory;
    private IndexWriter indexWriter;
    private LuceneIndexService indexService;
    private LuceneSearchService searchService;

    @BeforeEach
    void setUp() throws IOException {
        StandardAnalyzer analyzer;
        try (InputStream in = getClass().getResourceAsStream("/stopwords.txt")) {
            analyzer = new StandardAnalyzer(LuceneConfig.readStopwords(in));
        }
        BM25Similarity similarity = new BM25Similarity(1.2f, 0.75f);
        directory = new ByteBuffersDirectory();
        indexWriter = new IndexWriter(directory, LuceneConfig.writerConfig(analyzer, similarity));
        indexService = new LuceneIndexService(indexWriter, new ObjectMapper());
        searchService = new LuceneSearchService(indexWriter, analyzer, similarity);
    }

    @AfterEach
    void tearDown() throws IOException {
        indexWriter.close();
        directory.close();
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        @DisplayName("should replace a document's whole chunk set")
        void shouldReplaceChunkSet() throws IOException {
            indexService.replaceDocument("docA", List.of(
                    entry("docA", 0, "first version one", 1f, 0f, 0f, 0f),
                    entry("docA", 1, "first version two", 0f, 1f, 0f, 0f),
                    entry("docA", 2, "first version three", 0f, 0f, 1f, 0f)));
            indexService.replaceDocument("docB", List.of(entry("docB", 0, "other document", 0f, 0f, 0f, 1f)));

            indexService.replaceDocument("docA", List.of(entry("docA", 0, "second version", 1f, 1f, 0f, 0f)));

            assertEquals(1, indexService.countByDocumentId("docA"));
            assertEquals(1, indexService.countByDocumentId("docB"));
            assertEquals(List.of("docA_c0"), indexService.chunkIds("docA"));
            assertEquals(2, indexService.getChunkCount());
        }

        @Test
        @DisplayName("should restore chunks and vectors from a snapshot")
        void shouldSnapshot() throws IOException {
            IndexedChunk original = entry("docA", 1, "Photosynthesis converts light.", 0.5f, 0.25f, 0f, 1f);
            original.chunk().setEntities(new TreeMap<>(Map.of("YEAR", Set.of("2019"))));
            indexService.replaceDocument("docA", List.of(original, entry("docA", 0, "Intro.", 1f, 0f, 0f, 0f)));

            List<IndexedChunk> snapshot = indexService.snapshot("docA");

            assertEquals(2, snapshot.size());
            assertEquals(0, snapshot.get(0).chunk().getChunkIndex());
            assertEquals(original.chunk(), snapshot.get(1).chunk());
            assertArrayEquals(original.vector(), snapshot.get(1).vector());
        }

        @Test
        @DisplayName("should insert or replace a single chunk by its id")
        void shouldUpsertChunk() throws IOException {
            indexService.replaceDocument("docA", List.of(
                    entry("docA", 0, "one", 1f, 0f, 0f, 0f), entry("docA", 1, "two", 0f, 1f, 0f, 0f)));

            indexService.upsertChunk(entry("docA", 1, "two revised", 0f, 1f, 1f, 0f));
            indexService.upsertChunk(entry("docA", 2, "three", 0f, 0f, 1f, 0f));

            List<IndexedChunk> snapshot = indexService.snapshot("docA");
            assertEquals(List.of("docA_c0", "docA_c1", "docA_c2"), indexService.chunkIds("docA"));
            assertEquals("two revised", snapshot.get(1).chunk().getContent());
        }

        @Test
        @DisplayName("should refuse chunks of another document")
        void shouldRejectForeignChunks() {
            assertThrows(IllegalArgumentException.class,
                    () -> indexService.replaceDocument("docA", List.of(entry("docB", 0, "x", 1f, 0f, 0f, 0f))));
        }

        @Test
        @DisplayName("should remove every chunk of a deleted document")
        void shouldDelete() throws IOException {
            indexService.replaceDocument("docA", List.of(
                    entry("docA", 0, "one", 1f, 0f, 0f, 0f), entry("docA", 1, "two", 0f, 1f, 0f, 0f)));

            indexService.deleteByDocumentId("docA");

            assertEquals(0, indexService.countByDocumentId("docA"));
            assertTrue(indexService.snapshot("docA").isEmpty());
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @BeforeEach
        void index() throws IOException {
            indexService.replaceDocument("plants", List.of(
                    entry("plants", 0, "Photosynthesis converts sunlight into chemical energy.", 1f, 0f, 0f, 0f),
                    entry("plants", 1, "Roots absorb water from the soil.", 0f, 1f, 0f, 0f)));
            indexService.replaceDocument("stars", List.of(
                    entry("stars", 0, "Stars produce energy through nuclear fusion.", 0f, 0f, 1f, 0f)));
        }

        @Test
        @DisplayName("should rank keyword matches with BM25")
        void shouldFindKeywords() throws IOException {
            List<SearchResult> results = searchService.keywordSearch("photosynthesis", null, 10);

            assertEquals(1, results.size());
            assertEquals("plants_c0", results.get(0).getChunkId());
            assertEquals("plants", results.get(0).getDocumentId());
            assertTrue(results.get(0).getScore() > 0);
        }

        @Test
        @DisplayName("should restrict keyword hits to the given documents")
        void shouldFilterByDocument() throws IOException {
            assertEquals(2, searchService.keywordSearch("energy", null, 10).size());

            List<SearchResult> filtered = searchService.keywordSearch("energy", List.of("stars"), 10);

            assertEquals(1, filtered.size());
            assertEquals("stars_c0", filtered.get(0).getChunkId());
        }

        @Test
        @DisplayName("should search invalid query syntax literally")
        void shouldEscapeBrokenSyntax() throws IOException {
            List<SearchResult> results = searchService.keywordSearch("nuclear fusion (", null, 10);

            assertEquals("stars_c0", results.get(0).getChunkId());
        }

        @Test
        @DisplayName("should return nearest vectors first")
        void shouldRankByCosine() throws IOException {
            List<SearchResult> results = searchService.vectorSearch(new float[]{0.1f, 1f, 0f, 0f}, null, 2);

            assertEquals(2, results.size());
            assertEquals("plants_c1", results.get(0).getChunkId());
            assertEquals("plants_c0", results.get(1).getChunkId());
            assertTrue(results.get(0).getScore() >= results.get(1).getScore());
        }

        @Test
        @DisplayName("should apply the document filter to vector search")
        void shouldFilterVectors() throws IOException {
            List<SearchResult> results = searchService.vectorSearch(new float[]{1f, 0f, 0f, 0f}, List.of("stars"), 5);

            assertEquals(1, results.size());
            assertEquals("stars", results.get(0).getDocumentId());
        }

        @Test
        @DisplayName("should report chunk statistics")
        void shouldReportStatistics() throws IOException {
            Map<String, Object> stats = searchService.getChunkStatistics();

            assertEquals(2, stats.get("totalDocuments"));
            assertEquals(3, stats.get("totalChunks"));
            assertEquals(Map.of("en", 3), stats.get("chunksByLanguage"));
        }
    }

    private static IndexedChunk entry(String documentId, int index, String content, float... vector) {
        Chunk chunk = Chunk.builder()
                .chunkId(documentId + "_c" + index)
                .documentId(documentId)
                .chunkIndex(index)
                .content(content)
                .tokenCount(content.split("\\s+").length)
                .pageNumber(index + 1)
                .startOffset(0)
                .endOffset(content.length())
                .language("en")
                .build();
        return new IndexedChunk(chunk, vector);
    }
}
