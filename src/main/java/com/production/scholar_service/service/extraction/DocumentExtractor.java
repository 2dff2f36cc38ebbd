package com.production.scholar_service.service.extraction;

import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Text and property extraction for one file format.
 * Implementations are stateless and registered with {@link DocumentExtractorRegistry} by format.
 */
public interface DocumentExtractor {

    DocumentFormat format();

    /**
     * @throws IOException if the file cannot be read or is not a valid instance of the format
     */
    ExtractedContent extract(Path file) throws IOException;
}
