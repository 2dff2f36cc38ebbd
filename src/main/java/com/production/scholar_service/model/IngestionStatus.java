package com.production.scholar_service.model;

public enum IngestionStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
