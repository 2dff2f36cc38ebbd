package com.production.scholar_service.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class SearchResult {
    private String chunkId;
    private String documentId;
    private String content;
    private int pageNumber;
    private int chunkIndex;
    private String language;
    private float score;
}
