package com.titan.prepress.service;

import com.titan.prepress.model.FindingType;
import com.titan.prepress.model.FixType;
import com.titan.prepress.model.PrepressFinding;
import com.titan.prepress.model.PrepressFixLog;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.repository.FindingRepository;
import com.titan.prepress.repository.FixLogRepository;
import com.titan.prepress.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only store for findings and fix logs. Nothing is written for a job that has reached
 * a terminal state, and every read is scoped to an organization.
 */
@Service
@RequiredArgsConstructor
public class FindingsService {

    private static final Logger logger = LoggerFactory.getLogger(FindingsService.class);

    public static final String STANDALONE_ORG = "standalone";

    /** Cutting and finishing separations; never reported as spot-color problems. */
    static final Set<String> OPERATIONAL_SPOT_COLORS = Set.of("cutcontour", "spotwhite", "white", "cut", "dieline");

    private final JobRepository jobRepository;
    private final FindingRepository findingRepository;
    private final FixLogRepository fixLogRepository;
    private final Clock clock;

    public static String organizationOf(PrepressJob job) {
        return job.getOrganizationId() != null ? job.getOrganizationId() : STANDALONE_ORG;
    }

    @Transactional
    public PrepressFinding logMissingDpi(UUID jobId, int detectedDpi, int requiredDpi, String message) {
        PrepressJob job = requireWritable(jobId);
        // informational until DPI enforcement is switched on
        return findingRepository.save(PrepressFinding.builder()
                .organizationId(organizationOf(job))
                .jobId(jobId)
                .findingType(FindingType.MISSING_DPI)
                .severity("info")
                .message(message)
                .detectedDpi(detectedDpi)
                .requiredDpi(requiredDpi)
                .createdAt(clock.instant())
                .build());
    }

    /**
     * Returns empty for operational separations such as CutContour, which are expected in print files.
     */
    @Transactional
    public Optional<PrepressFinding> logSpotColor(UUID jobId, String spotColorName, String colorModel,
                                                  Integer pageNumber, String artboardName, String objectReference) {
        if (isOperationalSpotColor(spotColorName)) {
            logger.debug("Skipping operational spot color '{}' for job {}", spotColorName, jobId);
            return Optional.empty();
        }
        PrepressJob job = requireWritable(jobId);
        return Optional.of(findingRepository.save(PrepressFinding.builder()
                .organizationId(organizationOf(job))
                .jobId(jobId)
                .findingType(FindingType.SPOT_COLOR_DETECTED)
                .severity("warning")
                .message("Spot color '" + spotColorName + "' detected")
                .spotColorName(spotColorName)
                .colorModel(colorModel)
                .pageNumber(pageNumber)
                .artboardName(artboardName)
                .objectReference(objectReference)
                .createdAt(clock.instant())
                .build()));
    }

    /**
     * @param actor user who applied the fix, null for automated fixes
     */
    @Transactional
    public PrepressFixLog logFix(UUID jobId, FixType fixType, String description, String actor,
                                 Map<String, Object> beforeSnapshot, Map<String, Object> afterSnapshot) {
        PrepressJob job = requireWritable(jobId);
        return fixLogRepository.save(PrepressFixLog.builder()
                .organizationId(organizationOf(job))
                .jobId(jobId)
                .fixType(fixType)
                .description(description)
                .fixedByUserId(actor)
                .beforeSnapshot(beforeSnapshot)
                .afterSnapshot(afterSnapshot)
                .createdAt(clock.instant())
                .build());
    }

    public List<PrepressFinding> getFindings(UUID jobId, String organizationId) {
        return findingRepository.findByJobIdAndOrganizationIdOrderByCreatedAtAsc(jobId, requireOrganization(organizationId));
    }

    public List<PrepressFixLog> getFixLogs(UUID jobId, String organizationId) {
        return fixLogRepository.findByJobIdAndOrganizationIdOrderByCreatedAtAsc(jobId, requireOrganization(organizationId));
    }

    static boolean isOperationalSpotColor(String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        return OPERATIONAL_SPOT_COLORS.contains(normalized);
    }

    private PrepressJob requireWritable(UUID jobId) {
        PrepressJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Job " + jobId + " does not exist"));
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is " + job.getStatus().wireName()
                    + "; its findings are immutable");
        }
        return job;
    }

    private static String requireOrganization(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId is required");
        }
        return organizationId;
    }
}
