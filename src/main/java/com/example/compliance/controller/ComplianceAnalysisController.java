package com.example.compliance.controller;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.CollectionStats;
import com.example.compliance.model.Job;
import com.example.compliance.model.SourceDocument;
import com.example.compliance.orchestrator.AnalysisJobOrchestrator;
import com.example.compliance.service.CorpusIndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for document upload, job polling and corpus indexing.
 */
@RestController
@RequestMapping("/api")
public class ComplianceAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAnalysisController.class);

    static final String VERSION = "1.0.0";

    private final AnalysisJobOrchestrator orchestrator;
    private final CorpusIndexingService indexingService;
    private final ComplianceProperties.Upload uploadRules;

    public ComplianceAnalysisController(AnalysisJobOrchestrator orchestrator,
                                        CorpusIndexingService indexingService,
                                        ComplianceProperties properties) {
        this.orchestrator = orchestrator;
        this.indexingService = indexingService;
        this.uploadRules = properties.upload();
    }

    /**
     * Accepts a technical document and starts its analysis in the background.
     *
     * <p>Endpoint: POST /api/upload
     * <p>Content-Type: multipart/form-data
     * <p>Parameter: file (pdf, txt or md by default)
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file) {
        // ── Input validation ──
        if (file.isEmpty()) {
            return badRequest("Empty file. Please upload a valid document.");
        }
        String filename = file.getOriginalFilename();
        String extension = extensionOf(filename);
        if (!uploadRules.allowedExtensions().contains(extension)) {
            return badRequest("Invalid file type. Allowed: " + String.join(", ", uploadRules.allowedExtensions()));
        }
        if (file.getSize() > uploadRules.maxFileSizeBytes()) {
            return badRequest("File too large. Max size: " + uploadRules.maxFileSizeMb() + "MB");
        }

        log.info("Received upload '{}' ({} bytes)", filename, file.getSize());

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            log.error("Unable to read upload '{}'", filename, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Unable to read uploaded file", "message", String.valueOf(e.getMessage())));
        }

        Job job = orchestrator.submit(new SourceDocument(filename, content));
        return ResponseEntity.ok(Map.of(
                "jobId", job.id(),
                "status", job.status(),
                "message", "File uploaded successfully. Analysis started."
        ));
    }

    /**
     * Returns the job with its analysis, metrics and verdict once available.
     *
     * <p>Endpoint: GET /api/analyze/{jobId}
     */
    @GetMapping("/analyze/{jobId}")
    public ResponseEntity<?> getJob(@PathVariable String jobId) {
        return orchestrator.getJob(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Job not found: " + jobId)));
    }

    /**
     * Indexes the reference corpus into the vector index.
     *
     * <p>Endpoint: POST /api/index-corpus?forceReindex=false
     */
    @PostMapping("/index-corpus")
    public ResponseEntity<?> indexCorpus(@RequestParam(defaultValue = "false") boolean forceReindex) {
        try {
            int chunks = indexingService.indexCorpus(forceReindex);
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "message", "Indexed %d chunks".formatted(chunks),
                    "chunks", chunks
            ));
        } catch (Exception e) {
            log.error("Corpus indexing failed", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during corpus indexing",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * <p>Endpoint: GET /api/vector-stats
     */
    @GetMapping("/vector-stats")
    public CollectionStats vectorStats() {
        return indexingService.stats();
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean indexed = indexingService.isIndexed();
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "version", VERSION,
                "vectorDbStatus", indexed ? "ready" : "not_indexed",
                "llmStatus", "ready"
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
