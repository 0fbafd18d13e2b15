package com.titan.prepress.model;

import com.titan.prepress.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit entry for a fix applied to a job's file. {@code fixedByUserId} is null for automated fixes.
 */
@Entity
@Immutable
@Table(name = "prepress_fix_logs", indexes = {
        @Index(name = "prepress_fix_logs_job_idx", columnList = "prepress_job_id"),
        @Index(name = "prepress_fix_logs_org_idx", columnList = "organization_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrepressFixLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "prepress_job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "fix_type", nullable = false, length = 40)
    private FixType fixType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "fixed_by_user_id")
    private String fixedByUserId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "before_snapshot", columnDefinition = "TEXT")
    private Map<String, Object> beforeSnapshot;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "after_snapshot", columnDefinition = "TEXT")
    private Map<String, Object> afterSnapshot;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
