package com.production.scholar_service.service.ocr;

import com.production.scholar_service.exception.OcrFailureException;

import java.awt.image.BufferedImage;

/**
 * Recognizes the text on a rendered page image.
 */
public interface OcrEngine {

    /**
     * @param languages Tesseract language spec, e.g. {@code eng} or {@code deu+eng}
     */
    String recognize(BufferedImage image, String languages) throws OcrFailureException;
}
