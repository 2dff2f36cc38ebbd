package com.production.scholar_service.controller;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.model.Chunk;
import com.production.scholar_service.model.DocumentSummary;
import com.production.scholar_service.model.IngestionOptions;
import com.production.scholar_service.model.IngestionResponse;
import com.production.scholar_service.model.IngestionResponse.FileSubmission;
import com.production.scholar_service.model.IngestionStatus;
import com.production.scholar_service.model.JobStatusResponse;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataPatch;
import com.production.scholar_service.service.IngestionJobService;
import com.production.scholar_service.service.IngestionJobService.PendingFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Saves uploads to temp storage and hands them to {@link IngestionJobService}. Returns as soon as
 * the files are queued; progress is polled through the status endpoint.
 */
@RestController
@RequestMapping("/api/v1/documents")
@Slf4j
public class DocumentController {

    private final IngestionJobService ingestionJobService;
    private final AppConfig appConfig;

    public DocumentController(IngestionJobService ingestionJobService, AppConfig appConfig) {
        this.ingestionJobService = ingestionJobService;
        this.appConfig = appConfig;
    }

    @PostMapping(value = "/ingest", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResponse> ingest(
            @RequestPart("file") MultipartFile[] files,
            @RequestParam(value = "ocr", defaultValue = "true") boolean ocr,
            @RequestParam(value = "language", defaultValue = "auto") String language,
            @RequestParam(value = "sources", required = false) List<String> sources,
            @RequestParam(value = "harvest", defaultValue = "true") boolean harvest) {

        log.info("Ingestion request: {} file(s)", files.length);
        return handleUpload(files, options(ocr, language, sources, harvest), false);
    }

    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResponse> preview(
            @RequestPart("file") MultipartFile[] files,
            @RequestParam(value = "ocr", defaultValue = "true") boolean ocr,
            @RequestParam(value = "language", defaultValue = "auto") String language,
            @RequestParam(value = "sources", required = false) List<String> sources,
            @RequestParam(value = "harvest", defaultValue = "true") boolean harvest) {

        log.info("Preview request: {} file(s)", files.length);
        return handleUpload(files, options(ocr, language, sources, harvest), true);
    }

    @PostMapping("/preview/{documentId}/confirm")
    public ResponseEntity<FileSubmission> confirmPreview(
            @PathVariable String documentId,
            @RequestBody(required = false) MetadataPatch corrections) {
        return ResponseEntity.accepted().body(ingestionJobService.confirmPreview(documentId, corrections));
    }

    @GetMapping("/status/{id}")
    public ResponseEntity<JobStatusResponse> status(@PathVariable String id) {
        return ResponseEntity.ok(ingestionJobService.status(id));
    }

    @PostMapping("/{documentId}/reprocess")
    public ResponseEntity<JobStatusResponse> reprocess(@PathVariable String documentId) {
        log.info("Reprocess request for {}", documentId);
        return ResponseEntity.accepted().body(ingestionJobService.reprocess(documentId));
    }

    @PatchMapping("/{documentId}/metadata")
    public ResponseEntity<?> updateMetadata(@PathVariable String documentId, @RequestBody MetadataPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Bad Request",
                    "message", "No metadata fields given"
            ));
        }
        Metadata updated = ingestionJobService.updateMetadata(documentId, patch);
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String documentId) {
        log.debug("Delete request for document: {}", documentId);
        ingestionJobService.delete(documentId);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Document deleted successfully",
                "documentId", documentId
        ));
    }

    @GetMapping
    public ResponseEntity<List<DocumentSummary>> list() {
        return ResponseEntity.ok(ingestionJobService.listDocuments());
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentSummary> get(@PathVariable String documentId) {
        return ResponseEntity.ok(ingestionJobService.getDocument(documentId));
    }

    @GetMapping("/{documentId}/chunks")
    public ResponseEntity<List<Chunk>> chunks(@PathVariable String documentId) {
        return ResponseEntity.ok(ingestionJobService.getChunks(documentId));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() throws IOException {
        return ResponseEntity.ok(ingestionJobService.stats());
    }

    private ResponseEntity<IngestionResponse> handleUpload(MultipartFile[] files, IngestionOptions options, boolean preview) {
        if (files.length == 0) {
            return ResponseEntity.badRequest()
                    .body(IngestionResponse.builder()
                            .status(IngestionStatus.FAILED)
                            .message("No files provided")
                            .build());
        }

        // Validate all files before saving any
        long maxBytes = appConfig.getStorage().getMaxUploadBytes();
        for (MultipartFile file : files) {
            if (file.isEmpty()) {
                return ResponseEntity.badRequest()
                        .body(IngestionResponse.builder()
                                .status(IngestionStatus.FAILED)
                                .message("File is empty: " + file.getOriginalFilename())
                                .build());
            }
            if (file.getSize() > maxBytes) {
                return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                        .body(IngestionResponse.builder()
                                .status(IngestionStatus.FAILED)
                                .message("File too large: " + file.getOriginalFilename())
                                .build());
            }
        }

        // MultipartFile is request-scoped and won't survive the background job
        Path tempDir = null;
        List<PendingFile> pendingFiles = new ArrayList<>();
        try {
            tempDir = Files.createTempDirectory("ingest-");
            for (MultipartFile file : files) {
                Path tempPath = tempDir.resolve(UUID.randomUUID() + ".upload");
                file.transferTo(tempPath.toFile());
                pendingFiles.add(new PendingFile(tempPath, originalName(file)));
            }
        } catch (IOException e) {
            log.error("Failed to save uploaded files to temp directory", e);
            cleanupTempFiles(pendingFiles, tempDir);
            return ResponseEntity.internalServerError()
                    .body(IngestionResponse.builder()
                            .status(IngestionStatus.FAILED)
                            .message("Failed to prepare files for processing: " + e.getMessage())
                            .build());
        }

        List<FileSubmission> submissions;
        try {
            submissions = preview
                    ? ingestionJobService.preview(pendingFiles, options)
                    : ingestionJobService.ingest(pendingFiles, options);
        } finally {
            cleanupTempFiles(pendingFiles, tempDir);
        }

        long accepted = submissions.stream().filter(FileSubmission::isAccepted).count();
        IngestionStatus status = accepted == submissions.size() ? IngestionStatus.SUCCESS
                : accepted == 0 ? IngestionStatus.FAILED : IngestionStatus.PARTIAL;
        String message = preview
                ? accepted + " of " + submissions.size() + " file(s) ready for review"
                : accepted + " of " + submissions.size() + " file(s) submitted for processing";

        IngestionResponse body = IngestionResponse.builder()
                .status(status)
                .message(message)
                .filesSubmitted((int) accepted)
                .files(submissions)
                .build();
        if (accepted == 0) {
            return ResponseEntity.badRequest().body(body);
        }
        return preview ? ResponseEntity.ok(body) : ResponseEntity.accepted().body(body);
    }

    private static IngestionOptions options(boolean ocr, String language, List<String> sources, boolean harvest) {
        return IngestionOptions.builder()
                .ocrEnabled(ocr)
                .languageHint(language)
                .sources(sources == null ? new ArrayList<>() : new ArrayList<>(sources))
                .harvestMetadata(harvest)
                .build();
    }

    private static String originalName(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? "upload" : name;
    }

    private static void cleanupTempFiles(List<PendingFile> files, Path tempDir) {
        try {
            for (PendingFile pending : files) {
                Files.deleteIfExists(pending.tempPath());
            }
            if (tempDir != null) {
                Files.deleteIfExists(tempDir);
            }
        } catch (IOException e) {
            log.debug("Temp upload files not fully removed: {}", e.getMessage());
        }
    }
}
