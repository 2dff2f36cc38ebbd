package com.production.scholar_service.service.extraction;

import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.PageContent;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@Slf4j
public class PdfDocumentExtractor implements DocumentExtractor {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PDF;
    }

    @Override
    public ExtractedContent extract(Path file) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            List<PageContent> pages = new ArrayList<>();
            extractPages(document, pages);
            return ExtractedContent.builder()
                    .format(DocumentFormat.PDF)
                    .pages(pages)
                    .properties(readProperties(document.getDocumentInformation()))
                    .build();
        }
    }

    private void extractPages(PDDocument document, List<PageContent> pages) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        int totalPages = document.getNumberOfPages();

        for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
            stripper.setStartPage(pageNum);
            stripper.setEndPage(pageNum);

            String rawText = stripper.getText(document);

            pages.add(PageContent.builder()
                    .pageNumber(pageNum)
                    .rawText(rawText)
                    .build());

            log.debug("Extracted page {}/{}: {} characters", pageNum, totalPages, rawText.length());
        }
    }

    private Map<String, String> readProperties(PDDocumentInformation info) {
        Map<String, String> properties = new TreeMap<>();
        if (info == null) {
            return properties;
        }
        putIfPresent(properties, ExtractedContent.PROP_TITLE, info.getTitle());
        putIfPresent(properties, ExtractedContent.PROP_AUTHOR, info.getAuthor());
        putIfPresent(properties, ExtractedContent.PROP_SUBJECT, info.getSubject());
        putIfPresent(properties, ExtractedContent.PROP_KEYWORDS, info.getKeywords());
        if (info.getCreationDate() != null) {
            properties.put(ExtractedContent.PROP_CREATED, info.getCreationDate().toInstant().toString());
        }
        return properties;
    }

    static void putIfPresent(Map<String, String> properties, String key, String value) {
        if (value != null && !value.isBlank()) {
            properties.put(key, value.trim());
        }
    }
}
