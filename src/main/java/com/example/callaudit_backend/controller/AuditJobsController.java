package com.example.callaudit_backend.controller;

import com.example.callaudit_backend.dto.AuditJobRequest;
import com.example.callaudit_backend.dto.JobReport;
import com.example.callaudit_backend.dto.JobSummary;
import com.example.callaudit_backend.exception.ResourceExhaustedException;
import com.example.callaudit_backend.service.BatchEngine;
import com.example.callaudit_backend.service.JobArchiveService;
import com.example.callaudit_backend.util.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/audit-jobs")
public class AuditJobsController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuditJobsController.class);

    private final BatchEngine engine;
    private final JobArchiveService archive;

    public AuditJobsController(BatchEngine engine, JobArchiveService archive) {
        this.engine = engine;
        this.archive = archive;
    }

    public record SubmitRes(UUID jobId, JobStatus status, int submitted) {}
    public record CancelRes(UUID jobId, boolean cancelRequested) {}

    @Operation(summary = "Submit a folder or a list of call recordings for a compliance audit")
    @ApiResponse(responseCode = "202", description = "Job accepted and running in the background")
    @ApiResponse(responseCode = "400", description = "Missing folder/files or no recordings found")
    @ApiResponse(responseCode = "503", description = "Engine cannot accept more jobs right now")
    @PostMapping
    public ResponseEntity<SubmitRes> submit(@Valid @RequestBody AuditJobRequest req) {
        UUID jobId;
        try {
            if (req.folder() != null && !req.folder().isBlank()) {
                jobId = engine.submitFolder(req.userId(), Path.of(req.folder()));
            } else if (req.files() != null && !req.files().isEmpty()) {
                jobId = engine.submit(req.userId(), req.files().stream().map(Path::of).toList());
            } else {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FOLDER_OR_FILES_REQUIRED");
            }
        } catch (IllegalArgumentException ex) {
            // also covers InvalidPathException
            LOGGER.info("AuditJobsController reject user={} reason={}", req.userId(), ex.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (UncheckedIOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FOLDER_UNREADABLE", ex);
        } catch (ResourceExhaustedException ex) {
            LOGGER.warn("AuditJobsController busy user={} resource={}", req.userId(), ex.getResource());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "ENGINE_BUSY", ex);
        }
        JobReport report = engine.report(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "JOB_NOT_REGISTERED"));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmitRes(jobId, report.status(), report.submitted()));
    }

    @Operation(summary = "Progress or final report of an audit job")
    @ApiResponse(responseCode = "200", description = "Live progress or archived report")
    @ApiResponse(responseCode = "404", description = "Unknown job id")
    @GetMapping("/{id}")
    public JobReport get(@PathVariable UUID id) {
        return engine.report(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    @Operation(summary = "Stop dispatching files for a running job")
    @ApiResponse(responseCode = "202", description = "Cancellation requested")
    @ApiResponse(responseCode = "404", description = "Unknown job id")
    @ApiResponse(responseCode = "409", description = "Job already finished")
    @PostMapping("/{id}/cancel")
    public ResponseEntity<CancelRes> cancel(@PathVariable UUID id) {
        JobReport report = engine.report(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        if (!engine.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_ALREADY_" + report.status().name());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new CancelRes(id, true));
    }

    @Operation(summary = "Most recent archived jobs of a user")
    @GetMapping
    public List<JobSummary> recent(@RequestParam String userId) {
        return archive.recent(userId);
    }
}
