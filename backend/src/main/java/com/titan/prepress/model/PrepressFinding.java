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
 * A single preflight finding. Rows are insert-only; they are removed together with their job.
 */
@Entity
@Immutable
@Table(name = "prepress_findings", indexes = {
        @Index(name = "prepress_findings_job_idx", columnList = "prepress_job_id"),
        @Index(name = "prepress_findings_org_idx", columnList = "organization_id"),
        @Index(name = "prepress_findings_type_idx", columnList = "finding_type")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrepressFinding {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "prepress_job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "finding_type", nullable = false, length = 40)
    private FindingType findingType;

    @Column(nullable = false, length = 20)
    private String severity;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "page_number")
    private Integer pageNumber;

    @Column(name = "artboard_name")
    private String artboardName;

    @Column(name = "object_reference")
    private String objectReference;

    @Column(name = "spot_color_name")
    private String spotColorName;

    @Column(name = "color_model", length = 50)
    private String colorModel;

    @Column(name = "detected_dpi")
    private Integer detectedDpi;

    @Column(name = "required_dpi")
    private Integer requiredDpi;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
