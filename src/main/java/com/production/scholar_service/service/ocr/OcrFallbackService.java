package com.production.scholar_service.service.ocr;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.OcrFailureException;
import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.PageContent;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-reads image-only PDF pages with OCR.
 *
 * Triggered when the average extracted characters per page falls below the configured threshold.
 * Only pages that are themselves below the threshold are overwritten; pages with usable text are kept.
 * A page whose OCR fails keeps its (empty) primary text.
 */
@Service
@Slf4j
public class OcrFallbackService {

    private final OcrEngine ocrEngine;
    private final AppConfig appConfig;

    public OcrFallbackService(OcrEngine ocrEngine, AppConfig appConfig) {
        this.ocrEngine = ocrEngine;
        this.appConfig = appConfig;
    }

    public boolean needsOcr(ExtractedContent content) {
        if (!appConfig.getOcr().isEnabled()
                || content.getFormat() != DocumentFormat.PDF || content.getPages().isEmpty()) {
            return false;
        }
        long chars = content.getPages().stream().mapToLong(PageContent::contentLength).sum();
        double perPage = (double) chars / content.getPages().size();
        boolean needed = perPage < appConfig.getOcr().getMinCharsPerPage();
        log.debug("Extracted {} chars/page (threshold {}), OCR needed: {}",
                String.format("%.1f", perPage), appConfig.getOcr().getMinCharsPerPage(), needed);
        return needed;
    }

    public String ocrLanguages(String languageHint) {
        String hint = languageHint == null ? "auto" : languageHint.toLowerCase();
        return appConfig.getOcr().getLanguages().getOrDefault(hint, "deu+eng");
    }

    /**
     * Runs OCR over the weak pages of {@code pdf} and merges the text into {@code content} in page order.
     *
     * @return page numbers (1-based) whose text now comes from OCR
     */
    public List<Integer> apply(ExtractedContent content, Path pdf, String languageHint) throws IOException {
        String languages = ocrLanguages(languageHint);
        int threshold = appConfig.getOcr().getMinCharsPerPage();
        float dpi = appConfig.getOcr().getRenderDpi();
        List<Integer> ocrPages = new ArrayList<>();

        long start = System.currentTimeMillis();
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            PDFRenderer renderer = new PDFRenderer(document);
            for (PageContent page : content.getPages()) {
                if (page.contentLength() >= threshold) {
                    continue;
                }
                String text = recognizePage(renderer, page.getPageNumber(), dpi, languages);
                if (text != null && !text.isBlank()) {
                    page.setRawText(text);
                    page.setOcr(true);
                    ocrPages.add(page.getPageNumber());
                }
            }
        }
        log.info("[TIMING] OCR ({}): {}ms, {} of {} pages recognized",
                languages, System.currentTimeMillis() - start, ocrPages.size(), content.getPages().size());
        return ocrPages;
    }

    private String recognizePage(PDFRenderer renderer, int pageNumber, float dpi, String languages) {
        try {
            BufferedImage image = renderer.renderImageWithDPI(pageNumber - 1, dpi, ImageType.GRAY);
            return ocrEngine.recognize(image, languages);
        } catch (OcrFailureException | IOException e) {
            log.warn("OCR failed on page {}, leaving it empty: {}", pageNumber, e.getMessage());
            return "";
        }
    }
}
