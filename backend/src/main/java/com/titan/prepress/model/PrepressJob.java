package com.titan.prepress.model;

import com.titan.prepress.model.converter.JobErrorConverter;
import com.titan.prepress.model.converter.OutputManifestConverter;
import com.titan.prepress.model.converter.ReportSummaryConverter;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * A preflight job row. File paths are never stored here; they are derived from the id.
 * <p>
 * State machine: queued → running → (succeeded | failed), queued → cancelled.
 */
@Entity
@Table(name = "prepress_jobs", indexes = {
        @Index(name = "prepress_jobs_org_idx", columnList = "organization_id"),
        @Index(name = "prepress_jobs_status_idx", columnList = "status, created_at"),
        @Index(name = "prepress_jobs_expires_at_idx", columnList = "expires_at")
})
@Data
public class PrepressJob {

    @Id
    private UUID id;

    @Column(name = "organization_id")
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobMode mode;

    @Column(name = "original_filename", nullable = false, length = 512)
    private String originalFilename;

    @Column(name = "content_type", nullable = false)
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Convert(converter = ReportSummaryConverter.class)
    @Column(name = "report_summary", columnDefinition = "TEXT")
    private ReportSummary reportSummary;

    @Convert(converter = OutputManifestConverter.class)
    @Column(name = "output_manifest", columnDefinition = "TEXT")
    private OutputManifest outputManifest;

    @Convert(converter = JobErrorConverter.class)
    @Column(columnDefinition = "TEXT")
    private JobError error;

    @Column(name = "progress_message", columnDefinition = "TEXT")
    private String progressMessage;
}
