package com.production.scholar_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrievedChunk {
    private int rank;

    /** Number of this chunk in the answer prompt; null when it did not fit into the context. */
    private Integer marker;

    private String chunkId;
    private String documentId;
    private String content;
    private int pageNumber;
    private int chunkIndex;
    private String language;
    private float score;

    private String title;
    private List<String> authors;
    private Integer year;

    /** Inline citation in the requested style. */
    private String citation;
}
