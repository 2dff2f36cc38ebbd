package com.production.scholar_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentSummary {
    private String documentId;
    private String fileName;
    private DocumentFormat format;
    private String status;
    private Metadata metadata;
    private boolean needsReview;
    private int chunkCount;
    private List<Integer> ocrPages;
    private Long fileSizeBytes;
    private String errorStage;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime processedAt;

    public static DocumentSummary from(DocumentRecord record) {
        return DocumentSummary.builder()
                .documentId(record.getDocumentId())
                .fileName(record.getFileName())
                .format(record.getFormat())
                .status(record.getStatus().external())
                .metadata(record.getMetadata())
                .needsReview(record.isNeedsReview())
                .chunkCount(record.getChunks() == null ? 0 : record.getChunks().size())
                .ocrPages(record.getOcrPages())
                .fileSizeBytes(record.getFileSizeBytes())
                .errorStage(record.getErrorStage())
                .errorMessage(record.getErrorMessage())
                .createdAt(record.getCreatedAt())
                .processedAt(record.getProcessedAt())
                .build();
    }
}
