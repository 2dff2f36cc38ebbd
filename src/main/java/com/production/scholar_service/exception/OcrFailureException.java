package com.production.scholar_service.exception;

/**
 * OCR failed on a single page. Never aborts a document; the page text stays empty.
 */
public class OcrFailureException extends Exception {

    public OcrFailureException(String message) {
        super(message);
    }

    public OcrFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
