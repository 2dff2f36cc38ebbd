package com.production.scholar_service.model;

public record SourceReference(String documentId, String title, String reference) {
}
