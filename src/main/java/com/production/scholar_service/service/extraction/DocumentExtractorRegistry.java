package com.production.scholar_service.service.extraction;

import com.production.scholar_service.exception.UnsupportedFormatException;
import com.production.scholar_service.model.DocumentFormat;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the extractor for a file: by extension first, by sniffed content type when the extension is unknown.
 */
@Component
@Slf4j
public class DocumentExtractorRegistry {

    private final Map<DocumentFormat, DocumentExtractor> extractors = new EnumMap<>(DocumentFormat.class);
    private final Tika tika;

    public DocumentExtractorRegistry(List<DocumentExtractor> extractors, Tika tika) {
        this.tika = tika;
        for (DocumentExtractor extractor : extractors) {
            DocumentExtractor previous = this.extractors.put(extractor.format(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Two extractors registered for " + extractor.format());
            }
        }
        log.info("Registered extractors for formats: {}", this.extractors.keySet());
    }

    public DocumentFormat detectFormat(Path file, String fileName) {
        Optional<DocumentFormat> byName = DocumentFormat.fromFileName(fileName);
        if (byName.isPresent()) {
            return byName.get();
        }
        try {
            String mimeType = tika.detect(file);
            log.debug("Sniffed content type of {}: {}", fileName, mimeType);
            return DocumentFormat.fromMimeType(mimeType)
                    .orElseThrow(() -> new UnsupportedFormatException(
                            "Unsupported file type '" + mimeType + "' for " + fileName));
        } catch (IOException e) {
            throw new UnsupportedFormatException("Cannot determine file type of " + fileName, e);
        }
    }

    public DocumentExtractor extractorFor(DocumentFormat format) {
        DocumentExtractor extractor = extractors.get(format);
        if (extractor == null) {
            throw new UnsupportedFormatException("No extractor registered for " + format);
        }
        return extractor;
    }

    public boolean supports(String fileName) {
        return DocumentFormat.fromFileName(fileName).map(extractors::containsKey).orElse(false);
    }
}
