package com.production.scholar_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chunk {
    private String chunkId;
    private String documentId;
    private int chunkIndex;
    private String content;
    private int tokenCount;
    private int pageNumber;
    private int startOffset;
    private int endOffset;
    private String language;

    /** Entity type to the surface forms found in this chunk. */
    @Builder.Default
    private Map<String, Set<String>> entities = new TreeMap<>();
}
