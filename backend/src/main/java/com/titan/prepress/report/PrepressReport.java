package com.titan.prepress.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.titan.prepress.model.JobMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Report contract {@value #VERSION}. Fields may be added, never renamed or removed;
 * breaking changes need a new version string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"version", "jobId", "mode", "timestamp", "input", "summary", "issues", "analysis",
        "toolAvailability", "toolVersions", "normalization", "fix"})
public class PrepressReport {

    public static final String VERSION = "prepress_report_v1";

    @Builder.Default
    private String version = VERSION;
    private UUID jobId;
    private JobMode mode;
    private Instant timestamp;
    private Input input;
    private ScoreSnapshot summary;
    private List<Issue> issues;
    private PrepressAnalysis analysis;
    private Map<String, Boolean> toolAvailability;
    private Map<String, String> toolVersions;
    private NormalizationInfo normalization;
    private FixResult fix;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Input {
        private String filename;
        private long sizeBytes;
        private int pageCount;
    }
}
