package com.titan.prepress.controller;

import com.titan.prepress.model.PrepressFinding;
import com.titan.prepress.model.PrepressFixLog;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.service.PrepressException;
import com.titan.prepress.service.PrepressJobService;
import com.titan.prepress.storage.OutputKind;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api/prepress/jobs")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PrepressJobController {

    static final String ORGANIZATION_HEADER = "X-Organization-Id";
    static final String FILENAME_HEADER = "X-Filename";

    private final PrepressJobService jobService;

    /**
     * Raw upload: the request body is the file itself.
     */
    @PostMapping
    public ResponseEntity<?> createJob(
            @RequestBody(required = false) byte[] body,
            @RequestParam(value = "mode", defaultValue = "check") String mode,
            @RequestHeader(value = FILENAME_HEADER, required = false) String filename,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        try {
            PrepressJob job = jobService.createJob(body, filename, contentType, mode, organizationId);
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("jobId", job.getId()));
        } catch (PrepressException e) {
            return error(e);
        }
    }

    @GetMapping
    public ResponseEntity<List<PrepressJob>> listJobs(
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        return ResponseEntity.ok(jobService.listJobs(organizationId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PrepressJob> getJob(
            @PathVariable UUID id,
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        return jobService.getJob(id, organizationId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/report")
    public ResponseEntity<?> getJobReport(
            @PathVariable UUID id,
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        try {
            String reportJson = jobService.getJobReport(id, organizationId);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(reportJson);
        } catch (PrepressException e) {
            return error(e);
        }
    }

    @GetMapping("/{id}/download/{kind}")
    public ResponseEntity<?> download(
            @PathVariable UUID id,
            @PathVariable String kind,
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        Optional<OutputKind> outputKind = OutputKind.fromWireName(kind);
        if (outputKind.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown output kind: " + kind));
        }
        try {
            byte[] content = jobService.getOutput(id, outputKind.get(), organizationId);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(outputKind.get().contentType()))
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename=\"" + outputKind.get().downloadName(id) + "\"")
                    .body(content);
        } catch (PrepressException e) {
            return error(e);
        }
    }

    @GetMapping("/{id}/findings")
    public ResponseEntity<?> getFindings(
            @PathVariable UUID id,
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        try {
            List<PrepressFinding> findings = jobService.getFindings(id, organizationId);
            return ResponseEntity.ok(findings);
        } catch (PrepressException e) {
            return error(e);
        }
    }

    @GetMapping("/{id}/fixes")
    public ResponseEntity<?> getFixes(
            @PathVariable UUID id,
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        try {
            List<PrepressFixLog> fixes = jobService.getFixLogs(id, organizationId);
            return ResponseEntity.ok(fixes);
        } catch (PrepressException e) {
            return error(e);
        }
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancelJob(
            @PathVariable UUID id,
            @RequestHeader(value = ORGANIZATION_HEADER, required = false) String organizationId) {
        try {
            return ResponseEntity.ok(jobService.cancelJob(id, organizationId));
        } catch (PrepressException e) {
            return error(e);
        }
    }

    private static ResponseEntity<Map<String, String>> error(PrepressException e) {
        return ResponseEntity.status(statusFor(e)).body(Map.of("error", e.getMessage(), "code", e.getCode()));
    }

    static HttpStatus statusFor(PrepressException e) {
        return switch (e.getCode()) {
            case PrepressJobService.JOB_NOT_FOUND, PrepressJobService.OUTPUT_MISSING -> HttpStatus.NOT_FOUND;
            case PrepressJobService.JOB_NOT_READY, PrepressJobService.JOB_NOT_CANCELLABLE -> HttpStatus.CONFLICT;
            case PrepressJobService.FILE_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case PrepressJobService.INVALID_INPUT, PrepressJobService.UNSUPPORTED_FORMAT -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
