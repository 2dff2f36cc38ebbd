package com.production.scholar_service.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "query is required")
    private String query;

    private QueryMode mode;

    /** Case-insensitive substring matched against every author of a document. */
    private String author;

    private Integer yearFrom;
    private Integer yearTo;

    private List<String> documentIds;

    @Min(value = 1, message = "maxResults must be at least 1")
    private Integer maxResults;

    /** apa, mla, chicago, harvard or ieee. */
    private String citationStyle;

    private boolean rerankByRecency;

    public QueryMode effectiveMode() {
        return mode == null ? QueryMode.QUESTION : mode;
    }
}
