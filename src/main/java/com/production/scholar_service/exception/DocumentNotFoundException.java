package com.production.scholar_service.exception;

public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(String id) {
        super("Document or job not found: " + id);
    }
}
