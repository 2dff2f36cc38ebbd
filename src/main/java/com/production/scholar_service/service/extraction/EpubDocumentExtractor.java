package com.production.scholar_service.service.extraction;

import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.PageContent;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.Property;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.production.scholar_service.service.extraction.PdfDocumentExtractor.putIfPresent;

/**
 * EPUB through Tika. Chapters are concatenated in spine order into a single page.
 */
@Component
public class EpubDocumentExtractor implements DocumentExtractor {

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public DocumentFormat format() {
        return DocumentFormat.EPUB;
    }

    @Override
    public ExtractedContent extract(Path file) throws IOException {
        BodyContentHandler handler = new BodyContentHandler(-1);
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());

        try (TikaInputStream in = TikaInputStream.get(file)) {
            parser.parse(in, handler, metadata, new ParseContext());
        } catch (TikaException | SAXException e) {
            throw new IOException("Cannot parse EPUB " + file.getFileName() + ": " + e.getMessage(), e);
        }

        return ExtractedContent.builder()
                .format(DocumentFormat.EPUB)
                .pages(List.of(PageContent.builder().pageNumber(1).rawText(handler.toString()).build()))
                .properties(readProperties(metadata))
                .build();
    }

    private Map<String, String> readProperties(Metadata metadata) {
        Map<String, String> properties = new TreeMap<>();
        putIfPresent(properties, ExtractedContent.PROP_TITLE, get(metadata, TikaCoreProperties.TITLE));
        putIfPresent(properties, ExtractedContent.PROP_AUTHOR, get(metadata, TikaCoreProperties.CREATOR));
        putIfPresent(properties, ExtractedContent.PROP_PUBLISHER, get(metadata, TikaCoreProperties.PUBLISHER));
        putIfPresent(properties, ExtractedContent.PROP_IDENTIFIER, get(metadata, TikaCoreProperties.IDENTIFIER));
        putIfPresent(properties, ExtractedContent.PROP_LANGUAGE, get(metadata, TikaCoreProperties.LANGUAGE));
        putIfPresent(properties, ExtractedContent.PROP_CREATED, get(metadata, TikaCoreProperties.CREATED));
        return properties;
    }

    private String get(Metadata metadata, Property property) {
        String[] values = metadata.getValues(property);
        return values.length == 0 ? null : String.join("; ", values);
    }
}
