package com.production.scholar_service.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum DocumentFormat {
    PDF(List.of("pdf"), List.of("application/pdf")),
    EPUB(List.of("epub"), List.of("application/epub+zip")),
    DOCX(List.of("docx"), List.of("application/vnd.openxmlformats-officedocument.wordprocessingml.document")),
    PPTX(List.of("pptx"), List.of("application/vnd.openxmlformats-officedocument.presentationml.presentation")),
    TXT(List.of("txt", "text", "md"), List.of("text/plain", "text/markdown"));

    private final List<String> extensions;
    private final List<String> mimeTypes;

    DocumentFormat(List<String> extensions, List<String> mimeTypes) {
        this.extensions = extensions;
        this.mimeTypes = mimeTypes;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public static Optional<DocumentFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.extensions.contains(extension))
                .findFirst();
    }

    public static Optional<DocumentFormat> fromMimeType(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        String base = mimeType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.mimeTypes.contains(base))
                .findFirst();
    }
}
