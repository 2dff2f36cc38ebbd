package com.production.scholar_service.service.ocr;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.OcrFailureException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaConfigException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.ocr.TesseractOCRConfig;
import org.apache.tika.parser.ocr.TesseractOCRParser;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;

/**
 * Tesseract through Tika's OCR parser. Requires a local tesseract installation with the language packs in use.
 */
@Component
@Slf4j
public class TikaOcrEngine implements OcrEngine {

    private final TesseractOCRParser parser = new TesseractOCRParser();
    private final AppConfig appConfig;
    private final boolean available;

    public TikaOcrEngine(AppConfig appConfig) {
        this.appConfig = appConfig;
        String tesseractPath = appConfig.getOcr().getTesseractPath();
        if (tesseractPath != null && !tesseractPath.isBlank()) {
            parser.setTesseractPath(tesseractPath);
        }
        this.available = initialize();
    }

    private boolean initialize() {
        try {
            parser.initialize(Map.of());
            if (!parser.hasTesseract()) {
                log.warn("tesseract not found (path: '{}'); scanned pages will stay empty",
                        appConfig.getOcr().getTesseractPath());
                return false;
            }
            log.info("Tesseract OCR ready");
            return true;
        } catch (TikaConfigException e) {
            log.warn("Tesseract OCR could not be initialized: {}", e.getMessage());
            return false;
        }
    }

    public boolean isAvailable() {
        return available;
    }

    @Override
    public String recognize(BufferedImage image, String languages) throws OcrFailureException {
        if (!available) {
            throw new OcrFailureException("tesseract is not installed");
        }
        TesseractOCRConfig config = new TesseractOCRConfig();
        config.setLanguage(languages);
        config.setTimeoutSeconds(appConfig.getOcr().getPageTimeoutSeconds());

        ParseContext context = new ParseContext();
        context.set(TesseractOCRConfig.class, config);

        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, "page.png");
        metadata.set(Metadata.CONTENT_TYPE, "image/png");
        BodyContentHandler handler = new BodyContentHandler(-1);

        try (TikaInputStream in = TikaInputStream.get(toPng(image))) {
            parser.parse(in, handler, metadata, context);
            return handler.toString();
        } catch (IOException | SAXException | TikaException e) {
            throw new OcrFailureException("Tesseract failed: " + e.getMessage(), e);
        }
    }

    private byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
