package com.production.scholar_service.service.extraction;

import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.PageContent;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.production.scholar_service.service.extraction.PdfDocumentExtractor.putIfPresent;

/**
 * Word documents carry no page layout, so the whole body is reported as page 1.
 * The page count written by the authoring application is kept as the declared count.
 */
@Component
public class DocxDocumentExtractor implements DocumentExtractor {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.DOCX;
    }

    @Override
    public ExtractedContent extract(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             XWPFDocument document = new XWPFDocument(in);
             XWPFWordExtractor extractor = new XWPFWordExtractor(document)) {

            String text = extractor.getText();
            POIXMLProperties properties = document.getProperties();

            return ExtractedContent.builder()
                    .format(DocumentFormat.DOCX)
                    .pages(List.of(PageContent.builder().pageNumber(1).rawText(text).build()))
                    .properties(readProperties(properties.getCoreProperties()))
                    .declaredPageCount(declaredPages(properties))
                    .build();
        }
    }

    private Integer declaredPages(POIXMLProperties properties) {
        var extended = properties.getExtendedProperties().getUnderlyingProperties();
        return extended.isSetPages() ? extended.getPages() : null;
    }

    static Map<String, String> readProperties(POIXMLProperties.CoreProperties core) {
        Map<String, String> result = new TreeMap<>();
        putIfPresent(result, ExtractedContent.PROP_TITLE, core.getTitle());
        putIfPresent(result, ExtractedContent.PROP_AUTHOR, core.getCreator());
        putIfPresent(result, ExtractedContent.PROP_SUBJECT, core.getSubject());
        putIfPresent(result, ExtractedContent.PROP_KEYWORDS, core.getKeywords());
        putIfPresent(result, ExtractedContent.PROP_IDENTIFIER, core.getIdentifier());
        if (core.getCreated() != null) {
            result.put(ExtractedContent.PROP_CREATED, core.getCreated().toInstant().toString());
        }
        return result;
    }
}
