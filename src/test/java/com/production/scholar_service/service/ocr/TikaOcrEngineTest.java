package com.production.scholar_service.service.ocr;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.OcrFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the engine against a stand-in tesseract script that answers the version check and writes
 * a fixed text for every image, so the Tika bridge is exercised without a real installation.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class TikaOcrEngineTest {

    private static final String FAKE_TESSERACT = """
            #!/bin/sh
            case "$1" in
              -v|--version) echo "tesseract 5.3.0"; exit 0 ;;
              --list-langs) echo "List of available languages (2):"; echo deu; echo eng; exit 0 ;;
            esac
            if [ $# -lt 2 ]; then exit 0; fi
            printf 'SCANNED PAGE TEXT' > "$2.txt"
            """;

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should hand rendered pages to tesseract and return its text")
    void shouldRecognizeWithInstalledTesseract() throws Exception {
        Path bin = Files.createDirectories(tempDir.resolve("bin"));
        Path script = bin.resolve("tesseract");
        Files.writeString(script, FAKE_TESSERACT);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));

        TikaOcrEngine engine = new TikaOcrEngine(config(bin));

        assertTrue(engine.isAvailable());
        assertTrue(engine.recognize(page(), "deu+eng").contains("SCANNED PAGE TEXT"));
    }

    @Test
    @DisplayName("should fail each page instead of returning nothing when tesseract is missing")
    void shouldFailWithoutTesseract() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        TikaOcrEngine engine = new TikaOcrEngine(config(empty));

        assertFalse(engine.isAvailable());
        assertThrows(OcrFailureException.class, () -> engine.recognize(page(), "eng"));
    }

    private static AppConfig config(Path tesseractDir) {
        AppConfig appConfig = new AppConfig();
        appConfig.getOcr().setTesseractPath(tesseractDir.toString());
        appConfig.getOcr().setPageTimeoutSeconds(10);
        return appConfig;
    }

    private static BufferedImage page() {
        BufferedImage image = new BufferedImage(200, 80, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, 200, 80);
        graphics.setColor(Color.BLACK);
        graphics.drawString("Scanned", 20, 40);
        graphics.dispose();
        return image;
    }
}
