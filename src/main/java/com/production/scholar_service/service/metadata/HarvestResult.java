package com.production.scholar_service.service.metadata;

import com.production.scholar_service.model.MetadataCandidate;

import java.util.List;
import java.util.Map;

/**
 * Candidates from all sources that answered, plus the outcome of every source consulted.
 */
public record HarvestResult(List<MetadataCandidate> candidates, Map<String, SourceOutcome> outcomes) {

    public static HarvestResult empty() {
        return new HarvestResult(List.of(), Map.of());
    }

    public boolean anyAnswered() {
        return outcomes.values().stream().anyMatch(o -> o == SourceOutcome.OK || o == SourceOutcome.EMPTY);
    }
}
