package com.production.scholar_service.model;

/**
 * A {@code [marker]} in a generated answer, resolved to the chunk it points at.
 */
public record Citation(int marker, String documentId, String chunkId, int page, String inline) {
}
