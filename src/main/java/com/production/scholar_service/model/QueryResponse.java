package com.production.scholar_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {
    private String query;
    private QueryMode mode;
    private String citationStyle;
    private int totalResults;
    private List<RetrievedChunk> results;

    /** Generated answer, question mode only. Null when generation failed or nothing was retrieved. */
    private String answer;
    private String answerError;

    private List<Citation> citations;
    private List<SourceReference> sources;
    private Map<String, Long> timing;
}
