package com.production.scholar_service.model;

import com.production.scholar_service.repository.converter.ChunkListConverter;
import com.production.scholar_service.repository.converter.IngestionOptionsConverter;
import com.production.scholar_service.repository.converter.IntegerListConverter;
import com.production.scholar_service.repository.converter.MetadataConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "documents")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String documentId;

    @Column(nullable = false, length = 1000)
    private String fileName;

    @Column(length = 2000)
    private String storedPath;

    @Enumerated(EnumType.STRING)
    private DocumentFormat format;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentStatus status;

    @Lob
    @Convert(converter = MetadataConverter.class)
    private Metadata metadata;

    @Lob
    @Convert(converter = ChunkListConverter.class)
    @Builder.Default
    private List<Chunk> chunks = new ArrayList<>();

    @Lob
    private String rawText;

    @Convert(converter = IntegerListConverter.class)
    @Column(length = 4000)
    @Builder.Default
    private List<Integer> ocrPages = new ArrayList<>();

    @Convert(converter = IngestionOptionsConverter.class)
    @Column(length = 2000)
    private IngestionOptions options;

    private boolean needsReview;

    private Long fileSizeBytes;

    private String errorStage;

    @Column(length = 2000)
    private String errorMessage;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime processedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
