package com.titan.prepress.service;

import com.titan.prepress.config.PrepressProperties;
import com.titan.prepress.model.JobMode;
import com.titan.prepress.model.JobStatus;
import com.titan.prepress.model.PrepressFinding;
import com.titan.prepress.model.PrepressFixLog;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.repository.JobRepository;
import com.titan.prepress.storage.LocalJobStorage;
import com.titan.prepress.storage.OutputKind;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Job intake and the read side used by the REST layer. A request without an organization
 * sees every job; with one, only that organization's jobs.
 */
@Service
@RequiredArgsConstructor
public class PrepressJobService {

    private static final Logger logger = LoggerFactory.getLogger(PrepressJobService.class);

    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";
    public static final String JOB_NOT_READY = "JOB_NOT_READY";
    public static final String JOB_NOT_CANCELLABLE = "JOB_NOT_CANCELLABLE";
    public static final String OUTPUT_MISSING = "OUTPUT_MISSING";
    public static final String INVALID_INPUT = "INVALID_INPUT";
    public static final String FILE_TOO_LARGE = "FILE_TOO_LARGE";
    public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";

    static final int LIST_LIMIT = 100;
    static final String DEFAULT_FILENAME = "upload";
    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private static final Set<String> ACCEPTED_EXTENSIONS = Set.of("pdf", "jpg", "jpeg", "png", "tif", "tiff", "ai", "psd");
    private static final Set<String> ACCEPTED_MIME_TYPES = Set.of(
            "application/pdf", "image/jpeg", "image/jpg", "image/png", "image/tiff",
            "application/postscript", "application/illustrator",
            "image/vnd.adobe.photoshop", "application/x-photoshop");

    private final JobStore jobStore;
    private final JobRepository jobRepository;
    private final LocalJobStorage storage;
    private final FindingsService findingsService;
    private final PrepressProperties properties;
    private final Clock clock;

    /**
     * Writes the upload to its job directory, then inserts the queued row, so a worker never
     * claims a job whose input is not on disk yet.
     */
    public PrepressJob createJob(byte[] content, String filename, String contentType, String mode, String organizationId) {
        if (content == null || content.length == 0) {
            throw new PrepressException(INVALID_INPUT, "Uploaded file is empty");
        }
        if (content.length > properties.maxUploadSizeBytes()) {
            throw new PrepressException(FILE_TOO_LARGE,
                    "File exceeds the maximum upload size of " + properties.getMaxUploadSizeMb() + " MB");
        }
        String name = filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename.trim();
        String type = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
        if (!isAccepted(name, type)) {
            throw new PrepressException(UNSUPPORTED_FORMAT,
                    "Unsupported file type. Please upload PDF, JPG, PNG, TIF, AI, or PSD files");
        }

        PrepressJob job = new PrepressJob();
        job.setId(UUID.randomUUID());
        job.setOrganizationId(organizationId);
        job.setMode(parseMode(mode));
        job.setOriginalFilename(name);
        job.setContentType(type);
        job.setSizeBytes(content.length);
        Instant now = clock.instant();
        job.setCreatedAt(now);
        job.setExpiresAt(now.plus(Duration.ofHours(properties.getJobTtlHours())));
        job.setProgressMessage("Queued");

        storage.writeInput(job.getId(), content);
        try {
            job = jobStore.insertQueued(job);
        } catch (RuntimeException e) {
            discardDirectory(job.getId());
            throw e;
        }
        logger.info("Queued job {} ({}, {} bytes, mode {})", job.getId(), name, content.length, job.getMode().wireName());
        return job;
    }

    public List<PrepressJob> listJobs(String organizationId) {
        PageRequest page = PageRequest.of(0, LIST_LIMIT);
        if (organizationId == null) {
            return jobRepository.findAllByOrderByCreatedAtDesc(page);
        }
        return jobRepository.findByOrganizationIdOrderByCreatedAtDesc(organizationId, page);
    }

    public Optional<PrepressJob> getJob(UUID id, String organizationId) {
        return jobRepository.findById(id).filter(job -> visibleTo(job, organizationId));
    }

    public String getJobReport(UUID id, String organizationId) {
        return new String(getOutput(id, OutputKind.REPORT_JSON, organizationId), StandardCharsets.UTF_8);
    }

    public byte[] getOutput(UUID id, OutputKind kind, String organizationId) {
        PrepressJob job = requireJob(id, organizationId);
        if (job.getStatus() != JobStatus.SUCCEEDED) {
            throw new PrepressException(JOB_NOT_READY, "Job is " + job.getStatus().wireName() + ", outputs are not available");
        }
        return storage.readOutput(id, kind)
                .orElseThrow(() -> new PrepressException(OUTPUT_MISSING, "No " + kind.wireName() + " output for job " + id));
    }

    public PrepressJob cancelJob(UUID id, String organizationId) {
        PrepressJob job = requireJob(id, organizationId);
        if (!jobStore.cancel(id)) {
            throw new PrepressException(JOB_NOT_CANCELLABLE, "Only queued jobs can be cancelled; job is "
                    + jobStore.find(id).map(j -> j.getStatus().wireName()).orElse("gone"));
        }
        logger.info("Cancelled job {}", id);
        return jobStore.find(id).orElse(job);
    }

    public List<PrepressFinding> getFindings(UUID id, String organizationId) {
        PrepressJob job = requireJob(id, organizationId);
        return findingsService.getFindings(id, FindingsService.organizationOf(job));
    }

    public List<PrepressFixLog> getFixLogs(UUID id, String organizationId) {
        PrepressJob job = requireJob(id, organizationId);
        return findingsService.getFixLogs(id, FindingsService.organizationOf(job));
    }

    static JobMode parseMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return JobMode.CHECK;
        }
        for (JobMode candidate : JobMode.values()) {
            if (candidate.wireName().equalsIgnoreCase(mode.trim())) {
                return candidate;
            }
        }
        throw new PrepressException(INVALID_INPUT, "Unknown mode '" + mode + "', expected check or check_and_fix");
    }

    private PrepressJob requireJob(UUID id, String organizationId) {
        return getJob(id, organizationId)
                .orElseThrow(() -> new PrepressException(JOB_NOT_FOUND, "Job not found"));
    }

    private static boolean visibleTo(PrepressJob job, String organizationId) {
        return organizationId == null || organizationId.equals(job.getOrganizationId());
    }

    private static boolean isAccepted(String filename, String contentType) {
        int dot = filename.lastIndexOf('.');
        String ext = dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        String mime = contentType.toLowerCase(Locale.ROOT).split(";")[0].trim();
        return ACCEPTED_EXTENSIONS.contains(ext) || ACCEPTED_MIME_TYPES.contains(mime);
    }

    private void discardDirectory(UUID jobId) {
        try {
            storage.deleteJobDirectory(jobId);
        } catch (IOException e) {
            logger.warn("Failed to remove directory of rejected job {}: {}", jobId, e.getMessage());
        }
    }
}
