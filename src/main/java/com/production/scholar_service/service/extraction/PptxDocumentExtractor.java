package com.production.scholar_service.service.extraction;

import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.PageContent;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One page per slide: slide text shapes in drawing order, then speaker notes.
 */
@Component
@Slf4j
public class PptxDocumentExtractor implements DocumentExtractor {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PPTX;
    }

    @Override
    public ExtractedContent extract(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             XMLSlideShow slideShow = new XMLSlideShow(in)) {

            List<PageContent> pages = new ArrayList<>();
            int slideNumber = 0;
            for (XSLFSlide slide : slideShow.getSlides()) {
                slideNumber++;
                StringBuilder text = new StringBuilder();
                for (XSLFShape shape : slide.getShapes()) {
                    if (shape instanceof XSLFTextShape textShape) {
                        appendLine(text, textShape.getText());
                    }
                }
                XSLFNotes notes = slide.getNotes();
                if (notes != null) {
                    for (List<XSLFTextParagraph> paragraphs : notes.getTextParagraphs()) {
                        for (XSLFTextParagraph paragraph : paragraphs) {
                            appendLine(text, paragraph.getText());
                        }
                    }
                }
                pages.add(PageContent.builder()
                        .pageNumber(slideNumber)
                        .rawText(text.toString())
                        .build());
            }
            log.debug("Extracted {} slides", pages.size());

            return ExtractedContent.builder()
                    .format(DocumentFormat.PPTX)
                    .pages(pages)
                    .properties(DocxDocumentExtractor.readProperties(
                            slideShow.getProperties().getCoreProperties()))
                    .build();
        }
    }

    private void appendLine(StringBuilder text, String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        if (text.length() > 0) {
            text.append('\n');
        }
        text.append(line.trim());
    }
}
