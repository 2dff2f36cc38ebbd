package com.production.scholar_service.service.metadata;

import com.production.scholar_service.exception.SourceUnavailableException;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataCandidate;

import java.util.List;

/**
 * An external bibliographic service queried with locally derived hints.
 */
public interface MetadataSource {

    /** Lower-case name used in configuration, provenance and source selection. */
    String name();

    /** Whether the hints carry enough for this source to run a query at all. */
    boolean supports(Metadata hints);

    /**
     * Candidates in the source's own relevance order. An empty list means the source answered but found nothing.
     */
    List<MetadataCandidate> lookup(Metadata hints) throws SourceUnavailableException;
}
