package com.production.scholar_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-upload processing options. Stored with the document so reprocessing repeats the same run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionOptions {

    @Builder.Default
    private boolean ocrEnabled = true;

    /** "auto", "de", "en" or "mixed". */
    @Builder.Default
    private String languageHint = "auto";

    /** Metadata sources to consult; empty means every configured source. */
    @Builder.Default
    private List<String> sources = new ArrayList<>();

    @Builder.Default
    private boolean harvestMetadata = true;

    public static IngestionOptions defaults() {
        return IngestionOptions.builder().build();
    }
}
