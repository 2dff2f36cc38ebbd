package com.production.scholar_service.service;

import com.production.scholar_service.config.AppConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Keeps each uploaded original under {@code <originals-path>/<documentId>/<fileName>} so documents
 * can be reprocessed without re-upload.
 */
@Component
@Slf4j
public class OriginalFileStore {

    private final Path root;

    public OriginalFileStore(AppConfig appConfig) {
        this.root = Paths.get(appConfig.getStorage().getOriginalsPath()).toAbsolutePath().normalize();
    }

    /**
     * Copies {@code source} into the store, or moves it when {@code move} is set.
     *
     * @return the stored path
     */
    public Path store(String documentId, String fileName, Path source, boolean move) throws IOException {
        Path dir = directoryOf(documentId);
        Files.createDirectories(dir);
        Path target = dir.resolve(safeFileName(fileName));
        if (move) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } else {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Stored original {} -> {}", fileName, target);
        return target;
    }

    public boolean exists(String storedPath) {
        return storedPath != null && Files.isRegularFile(Paths.get(storedPath));
    }

    public void delete(String documentId) throws IOException {
        Path dir = directoryOf(documentId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
        log.debug("Deleted stored originals for {}", documentId);
    }

    private Path directoryOf(String documentId) {
        Path dir = root.resolve(documentId).normalize();
        if (!dir.startsWith(root) || dir.equals(root)) {
            throw new IllegalArgumentException("Invalid document id: " + documentId);
        }
        return dir;
    }

    static String safeFileName(String fileName) {
        String name = fileName == null ? "" : Paths.get(fileName.replace('\\', '/')).getFileName().toString();
        name = name.replaceAll("[^\\p{L}\\p{N}._ -]", "_").trim();
        return name.isEmpty() || name.equals(".") || name.equals("..") ? "upload" : name;
    }
}
