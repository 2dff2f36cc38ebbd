package com.production.scholar_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial metadata edit. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetadataPatch {
    private String title;
    private List<String> authors;
    private Integer year;
    private String journal;
    private String publisher;
    private String doi;
    private String isbn;
    private String language;

    public boolean isEmpty() {
        return title == null && authors == null && year == null && journal == null
                && publisher == null && doi == null && isbn == null && language == null;
    }
}
