package com.production.scholar_service.service.extraction;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.CorruptFileException;
import com.production.scholar_service.exception.ExtractionTimeoutException;
import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.JobState;
import org.apache.tika.Tika;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionServiceTest {

    @TempDir
    Path tempDir;

    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolTaskExecutor executor;
    private AppConfig appConfig;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("extract-test-");
        executor.initialize();
        appConfig = new AppConfig();
        appConfig.getExtraction().setTimeoutSeconds(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    @DisplayName("should return the extracted content within the time limit")
    void shouldExtract() throws IOException {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "Some plain notes.");
        ExtractionService service = service(new PlainTextDocumentExtractor());

        ExtractedContent content = service.extract(file, "notes.txt");

        assertEquals(DocumentFormat.TXT, content.getFormat());
        assertEquals("Some plain notes.", content.getPages().get(0).getRawText());
    }

    @Test
    @DisplayName("should give up on extractions that exceed the time limit")
    void shouldTimeOut() throws IOException {
        Path file = Files.writeString(tempDir.resolve("slow.txt"), "never read");
        DocumentExtractor slow = new DocumentExtractor() {
            @Override
            public DocumentFormat format() {
                return DocumentFormat.TXT;
            }

            @Override
            public ExtractedContent extract(Path path) throws IOException {
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new IOException("released");
            }
        };

        ExtractionTimeoutException e = assertThrows(ExtractionTimeoutException.class,
                () -> service(slow).extract(file, "slow.txt"));
        assertEquals(JobState.EXTRACTING, e.getStage());
    }

    @Test
    @DisplayName("should report unreadable files as corrupt")
    void shouldReportCorruptFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf at all");

        assertThrows(CorruptFileException.class,
                () -> service(new PdfDocumentExtractor()).extract(file, "broken.pdf"));
    }

    private ExtractionService service(DocumentExtractor... extractors) {
        return new ExtractionService(new DocumentExtractorRegistry(List.of(extractors), new Tika()), executor, appConfig);
    }
}
