package com.production.scholar_service.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.lucene.IndexedChunk;
import com.production.scholar_service.lucene.LuceneIndexService;
import com.production.scholar_service.model.Chunk;
import com.production.scholar_service.model.DocumentRecord;
import com.production.scholar_service.model.DocumentStatus;
import com.production.scholar_service.model.IngestionOptions;
import com.production.scholar_service.model.JobState;
import com.production.scholar_service.repository.DocumentRecordRepository;
import com.production.scholar_service.service.embedding.ChunkEmbedder;
import com.production.scholar_service.service.extraction.DocumentExtractorRegistry;
import com.production.scholar_service.service.extraction.ExtractionService;
import com.production.scholar_service.service.extraction.PdfDocumentExtractor;
import com.production.scholar_service.service.extraction.PlainTextDocumentExtractor;
import com.production.scholar_service.service.job.JobTracker;
import com.production.scholar_service.service.job.ProcessingJob;
import com.production.scholar_service.service.metadata.LocalMetadataExtractor;
import com.production.scholar_service.service.metadata.MetadataHarvester;
import com.production.scholar_service.service.metadata.MetadataReconciler;
import com.production.scholar_service.service.ocr.OcrEngine;
import com.production.scholar_service.service.ocr.OcrFallbackService;
import com.production.scholar_service.service.segment.EntityRecognizer;
import com.production.scholar_service.service.segment.LanguageDetector;
import com.production.scholar_service.service.segment.Segmenter;
import com.production.scholar_service.service.segment.SentenceSplitter;
import com.production.scholar_service.service.segment.TextCleaningService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.tika.Tika;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DocumentPipelineServiceTest {

    private static final String OCR_TEXT = "Photosynthesis converts light energy into chemical energy. "
            + "The reaction takes place in the chloroplasts of green plants.";

    @TempDir
    Path tempDir;

    private AppConfig appConfig;
    private ThreadPoolTaskExecutor extractionExecutor;
    private Directory directory;
    private IndexWriter indexWriter;
    private LuceneIndexService indexService;
    private JobTracker jobTracker;
    private DocumentRecordRepository repository;
    private final Map<String, DocumentRecord> records = new HashMap<>();
    private boolean failCompletedSaves;

    @BeforeEach
    void setUp() throws IOException {
        appConfig = new AppConfig();
        appConfig.getOcr().setRenderDpi(36f);
        appConfig.getEmbedding().setDimensions(4);
        appConfig.getEmbedding().setMaxRetries(0);
        appConfig.getChunking().setMaxTokens(40);
        appConfig.getChunking().setOverlapTokens(8);

        extractionExecutor = new ThreadPoolTaskExecutor();
        extractionExecutor.setCorePoolSize(1);
        extractionExecutor.setThreadNamePrefix("extract-test-");
        extractionExecutor.initialize();

        directory = new ByteBuffersDirectory();
        indexWriter = new IndexWriter(directory, new IndexWriterConfig(new StandardAnalyzer()));
        indexService = new LuceneIndexService(indexWriter, new ObjectMapper());

        jobTracker = new JobTracker();
        repository = mock(DocumentRecordRepository.class);
        when(repository.findByDocumentId(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(records.get(inv.<String>getArgument(0))));
        when(repository.save(any(DocumentRecord.class))).thenAnswer(inv -> {
            DocumentRecord record = inv.getArgument(0);
            if (failCompletedSaves && record.getStatus() == DocumentStatus.COMPLETE) {
                throw new DataAccessResourceFailureException("database unavailable");
            }
            records.put(record.getDocumentId(), record);
            return record;
        });
    }

    @AfterEach
    void tearDown() throws IOException {
        extractionExecutor.shutdown();
        indexWriter.close();
        directory.close();
    }

    @Test
    @DisplayName("should OCR a scanned PDF and publish the recognized pages")
    void shouldProcessScannedPdf() throws IOException {
        Path pdf = blankPdf(tempDir.resolve("scan.pdf"), 2);
        ProcessingJob job = submit("scan", pdf, IngestionOptions.builder().harvestMetadata(false).build());

        pipeline((image, languages) -> OCR_TEXT, new VectorModel(false)).process(job);

        assertEquals(JobState.COMPLETE, job.getState());
        assertTrue(job.getHistory().contains(JobState.OCR));
        assertEquals(List.of(1, 2), job.getOcrPages());

        DocumentRecord record = records.get("scan");
        assertEquals(DocumentStatus.COMPLETE, record.getStatus());
        assertEquals(List.of(1, 2), record.getOcrPages());
        assertEquals(List.of(1, 2), record.getMetadata().getExtra().get(DocumentPipelineService.OCR_EXTRA));
        assertTrue(record.getRawText().contains("chloroplasts"));
        assertTrue(indexService.countByDocumentId("scan") > 0);
    }

    @Test
    @DisplayName("should fail at the embedding stage and leave the index untouched")
    void shouldFailOnEmbeddingError() throws IOException {
        Path text = Files.writeString(tempDir.resolve("notes.txt"), OCR_TEXT);
        ProcessingJob job = submit("notes", text, IngestionOptions.builder().harvestMetadata(false).build());

        pipeline(noOcr(), new VectorModel(true)).process(job);

        assertEquals(JobState.FAILED, job.getState());
        assertEquals(JobState.EMBEDDING, job.getFailedStage());
        DocumentRecord record = records.get("notes");
        assertEquals(DocumentStatus.FAILED, record.getStatus());
        assertEquals("EMBEDDING", record.getErrorStage());
        assertEquals(0, indexService.countByDocumentId("notes"));
    }

    @Test
    @DisplayName("should restore the previous index entries when the record cannot be saved")
    void shouldRestoreIndexWhenStoreFails() throws IOException {
        List<IndexedChunk> previous = List.of(
                previousEntry("notes", 0, "Earlier text about roots.", 0f, 1f, 0f, 0f),
                previousEntry("notes", 1, "Earlier text about leaves.", 0f, 0f, 1f, 0f));
        indexService.replaceDocument("notes", previous);
        Path text = Files.writeString(tempDir.resolve("notes.txt"), OCR_TEXT);
        ProcessingJob job = submit("notes", text, IngestionOptions.builder().harvestMetadata(false).build());
        failCompletedSaves = true;

        pipeline(noOcr(), new VectorModel(false)).process(job);

        assertEquals(JobState.FAILED, job.getState());
        assertEquals(JobState.EMBEDDING, job.getFailedStage());
        assertTrue(job.getErrorMessage().contains("Store update failed"));

        List<IndexedChunk> restored = indexService.snapshot("notes");
        assertEquals(previous.size(), restored.size());
        for (int i = 0; i < previous.size(); i++) {
            assertEquals(previous.get(i).chunk().getContent(), restored.get(i).chunk().getContent());
            assertArrayEquals(previous.get(i).vector(), restored.get(i).vector());
        }
        assertEquals(DocumentStatus.FAILED, records.get("notes").getStatus());
    }

    @Test
    @DisplayName("should not touch the record of a document deleted before its run starts")
    void shouldSkipDeletedDocument() throws IOException {
        Path text = Files.writeString(tempDir.resolve("notes.txt"), OCR_TEXT);
        ProcessingJob job = submit("notes", text, IngestionOptions.defaults());
        jobTracker.cancel("notes");
        records.remove("notes");

        pipeline(noOcr(), new VectorModel(false)).process(job);

        verify(repository, never()).save(any(DocumentRecord.class));
        assertFalse(records.containsKey("notes"));
        assertEquals(0, indexService.countByDocumentId("notes"));
    }

    private DocumentPipelineService pipeline(OcrEngine ocrEngine, EmbeddingModel embeddingModel) {
        ExtractionService extractionService = new ExtractionService(
                new DocumentExtractorRegistry(List.of(new PdfDocumentExtractor(), new PlainTextDocumentExtractor()), new Tika()),
                extractionExecutor, appConfig);
        LanguageDetector languageDetector = new LanguageDetector();
        return new DocumentPipelineService(
                extractionService,
                new OcrFallbackService(ocrEngine, appConfig),
                new TextCleaningService(),
                new LocalMetadataExtractor(languageDetector),
                mock(MetadataHarvester.class),
                new MetadataReconciler(appConfig),
                new Segmenter(appConfig, new SentenceSplitter(), new EntityRecognizer(), languageDetector),
                new ChunkEmbedder(embeddingModel, appConfig),
                indexService,
                repository,
                jobTracker);
    }

    private ProcessingJob submit(String documentId, Path file, IngestionOptions options) {
        records.put(documentId, DocumentRecord.builder()
                .documentId(documentId)
                .fileName(file.getFileName().toString())
                .storedPath(file.toString())
                .status(DocumentStatus.PENDING)
                .options(options)
                .build());
        return jobTracker.register(documentId, file.getFileName().toString());
    }

    private static OcrEngine noOcr() {
        return (image, languages) -> fail("text documents must not be OCR'd");
    }

    private static Path blankPdf(Path file, int pages) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < pages; i++) {
                document.addPage(new PDPage());
            }
            document.save(file.toFile());
        }
        return file;
    }

    private static IndexedChunk previousEntry(String documentId, int index, String content, float... vector) {
        Chunk chunk = Chunk.builder()
                .chunkId(documentId + "_c" + index)
                .documentId(documentId)
                .chunkIndex(index)
                .content(content)
                .tokenCount(content.split("\\s+").length)
                .pageNumber(1)
                .startOffset(0)
                .endOffset(content.length())
                .language("en")
                .build();
        return new IndexedChunk(chunk, vector);
    }

    private static final class VectorModel implements EmbeddingModel {

        private final boolean broken;

        VectorModel(boolean broken) {
            this.broken = broken;
        }

        @Override
        public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
            if (broken) {
                throw new IllegalStateException("embedding service unreachable");
            }
            List<Embedding> embeddings = new ArrayList<>();
            for (TextSegment segment : segments) {
                embeddings.add(Embedding.from(new float[]{segment.text().length(), 1f, 0f, 1f}));
            }
            return Response.from(embeddings);
        }
    }
}
