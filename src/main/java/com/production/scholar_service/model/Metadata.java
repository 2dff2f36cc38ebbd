package com.production.scholar_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reconciled bibliographic record of a document.
 * Every populated field has a provenance entry; unresolved fields stay null.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Metadata {

    private String title;

    @Builder.Default
    private List<String> authors = new ArrayList<>();

    private Integer year;
    private String journal;
    private String publisher;
    private String doi;
    private String isbn;
    private String language;
    private Integer pageCount;

    @Builder.Default
    private Map<String, FieldProvenance> provenance = new TreeMap<>();

    /** Source fields without a structured counterpart (type, subjects, issn, ...). */
    @Builder.Default
    private Map<String, Object> extra = new TreeMap<>();

    private boolean needsReview;

    public Object get(MetadataField field) {
        return field.get(this);
    }

    public void set(MetadataField field, Object value, FieldProvenance origin) {
        field.set(this, value);
        if (MetadataField.isEmpty(value)) {
            provenance.remove(field.key());
        } else {
            provenance.put(field.key(), origin);
        }
    }

    public FieldProvenance provenanceOf(MetadataField field) {
        return provenance.get(field.key());
    }

    public String firstAuthor() {
        return authors == null || authors.isEmpty() ? null : authors.get(0);
    }
}
