package com.production.scholar_service.service.ocr;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.OcrFailureException;
import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.PageContent;
import com.production.scholar_service.service.extraction.PdfDocumentExtractor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OcrFallbackServiceTest {

    private static final String TEXT_PAGE = "This page carries enough selectable text to stay out of OCR entirely.";

    @TempDir
    Path tempDir;

    private AppConfig appConfig;
    private final List<String> requestedLanguages = new ArrayList<>();

    @BeforeEach
    void setUp() {
        appConfig = new AppConfig();
        appConfig.getOcr().setRenderDpi(36f);
    }

    @Nested
    @DisplayName("trigger")
    class Trigger {

        @Test
        @DisplayName("should trigger when the average text per page is below the threshold")
        void shouldTriggerForScannedPdf() {
            OcrFallbackService service = new OcrFallbackService(engine("x"), appConfig);

            assertTrue(service.needsOcr(content(DocumentFormat.PDF, TEXT_PAGE, "", "")));
            assertFalse(service.needsOcr(content(DocumentFormat.PDF, TEXT_PAGE, TEXT_PAGE)));
        }

        @Test
        @DisplayName("should never trigger for formats other than PDF")
        void shouldIgnoreOtherFormats() {
            OcrFallbackService service = new OcrFallbackService(engine("x"), appConfig);

            assertFalse(service.needsOcr(content(DocumentFormat.DOCX, "")));
        }

        @Test
        @DisplayName("should map language hints to tesseract languages")
        void shouldMapLanguages() {
            OcrFallbackService service = new OcrFallbackService(engine("x"), appConfig);

            assertEquals("deu", service.ocrLanguages("DE"));
            assertEquals("eng", service.ocrLanguages("en"));
            assertEquals("deu+eng", service.ocrLanguages(null));
            assertEquals("deu+eng", service.ocrLanguages("fr"));
        }
    }

    @Test
    @DisplayName("should replace only the pages without usable text")
    void shouldReplaceWeakPagesOnly() throws IOException {
        Path pdf = writePdf(tempDir.resolve("scan.pdf"), TEXT_PAGE, null);
        ExtractedContent content = new PdfDocumentExtractor().extract(pdf);
        OcrFallbackService service = new OcrFallbackService(engine("Recognized scanned text"), appConfig);

        List<Integer> replaced = service.apply(content, pdf, "de");

        assertEquals(List.of(2), replaced);
        PageContent first = content.getPages().get(0);
        PageContent second = content.getPages().get(1);
        assertFalse(first.isOcr());
        assertTrue(first.getRawText().contains("selectable text"));
        assertTrue(second.isOcr());
        assertEquals("Recognized scanned text", second.getRawText());
        assertEquals(List.of("deu"), requestedLanguages);
    }

    @Test
    @DisplayName("should keep the empty page when recognition fails")
    void shouldSurviveEngineFailure() throws IOException {
        Path pdf = writePdf(tempDir.resolve("scan.pdf"), null, null);
        ExtractedContent content = new PdfDocumentExtractor().extract(pdf);
        OcrEngine failing = (image, languages) -> {
            throw new OcrFailureException("tesseract missing", null);
        };

        List<Integer> replaced = new OcrFallbackService(failing, appConfig).apply(content, pdf, "auto");

        assertTrue(replaced.isEmpty());
        assertFalse(content.getPages().get(0).isOcr());
        assertTrue(content.getPages().get(0).getRawText().isBlank());
    }

    private OcrEngine engine(String text) {
        return (image, languages) -> {
            assertNotNull(image);
            requestedLanguages.add(languages);
            return text;
        };
    }

    private static ExtractedContent content(DocumentFormat format, String... pages) {
        List<PageContent> pageList = new ArrayList<>();
        for (int i = 0; i < pages.length; i++) {
            pageList.add(PageContent.builder().pageNumber(i + 1).rawText(pages[i]).build());
        }
        return ExtractedContent.builder().format(format).pages(pageList).build();
    }

    /** Null entries produce blank pages, standing in for scanned images. */
    private static Path writePdf(Path file, String... pageTexts) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                document.addPage(page);
                if (text == null) {
                    continue;
                }
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    stream.beginText();
                    stream.setFont(font, 10);
                    stream.newLineAtOffset(40, 700);
                    stream.showText(text);
                    stream.endText();
                }
            }
            document.save(file.toFile());
        }
        return file;
    }
}
