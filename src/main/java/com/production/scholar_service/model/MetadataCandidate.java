package com.production.scholar_service.model;

import lombok.Builder;
import lombok.Data;

/**
 * One source's proposal for a document's metadata.
 */
@Data
@Builder
public class MetadataCandidate {

    private String source;

    /** 0..1; exactly 1.0 for identifier matches. */
    private double confidence;

    private MatchKey matchKey;

    /** Position in the source's own result list, 0 = most relevant. */
    private int rank;

    private Metadata fields;

    public boolean isIdentifierMatch() {
        return matchKey != null && matchKey.isIdentifier();
    }
}
