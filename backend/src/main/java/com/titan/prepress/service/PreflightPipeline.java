package com.titan.prepress.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titan.prepress.config.PrepressProperties;
import com.titan.prepress.model.FixType;
import com.titan.prepress.model.JobMode;
import com.titan.prepress.model.OutputManifest;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.report.FixResult;
import com.titan.prepress.report.ImageMetadata;
import com.titan.prepress.report.Issue;
import com.titan.prepress.report.Issues;
import com.titan.prepress.report.PrepressAnalysis;
import com.titan.prepress.report.PrepressReport;
import com.titan.prepress.report.ScoreSnapshot;
import com.titan.prepress.storage.InputAdapter;
import com.titan.prepress.storage.OutputAdapter;
import com.titan.prepress.storage.OutputKind;
import com.titan.prepress.toolchain.FontInspector;
import com.titan.prepress.toolchain.FontReport;
import com.titan.prepress.toolchain.FormatNormalizer;
import com.titan.prepress.toolchain.NormalizationResult;
import com.titan.prepress.toolchain.PdfMetadata;
import com.titan.prepress.toolchain.PdfMetadataExtractor;
import com.titan.prepress.toolchain.PdfRepairer;
import com.titan.prepress.toolchain.ProofRenderer;
import com.titan.prepress.toolchain.StructureCheck;
import com.titan.prepress.toolchain.StructureValidator;
import com.titan.prepress.toolchain.Tool;
import com.titan.prepress.toolchain.ToolDetector;
import com.titan.prepress.toolchain.ToolExecutionException;
import com.titan.prepress.toolchain.ToolchainStatus;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Runs the preflight checks for one job and persists the report plus derived outputs.
 * <p>
 * Missing tools and failing analysis steps become issues; only storage failures and
 * unexpected internal errors escape.
 */
@Service
@RequiredArgsConstructor
public class PreflightPipeline {

    private static final Logger logger = LoggerFactory.getLogger(PreflightPipeline.class);

    private final ToolDetector toolDetector;
    private final InputAdapter inputAdapter;
    private final OutputAdapter outputAdapter;
    private final FormatNormalizer formatNormalizer;
    private final StructureValidator structureValidator;
    private final PdfMetadataExtractor metadataExtractor;
    private final FontInspector fontInspector;
    private final ProofRenderer proofRenderer;
    private final PdfRepairer pdfRepairer;
    private final FindingsService findingsService;
    private final ObjectMapper objectMapper;
    private final PrepressProperties properties;
    private final Clock clock;

    public PipelineOutcome run(PrepressJob job, Consumer<String> progress) {
        UUID jobId = job.getId();
        boolean fixRequested = job.getMode() == JobMode.CHECK_AND_FIX;

        progress.accept("Detecting tools");
        ToolchainStatus tools = toolDetector.detect();
        byte[] input = inputAdapter.fetchInput(jobId);

        progress.accept("Normalizing file format");
        NormalizationResult normalization = formatNormalizer.normalize(
                input, job.getContentType(), job.getOriginalFilename(), tools);
        Issues issues = normalization.getIssues();
        PrepressAnalysis analysis = new PrepressAnalysis();

        if (!normalization.hasPdf()) {
            logger.info("Normalization produced no PDF for job {}, skipping PDF checks", jobId);
            PrepressReport report = buildReport(job, tools, normalization, issues, analysis, null);
            storeReport(jobId, report);
            return new PipelineOutcome(report, manifest(false, fixRequested, false));
        }
        byte[] pdf = normalization.getNormalizedPdf();

        progress.accept("Validating PDF structure");
        if (tools.isAvailable(Tool.QPDF)) {
            StructureCheck structure = structureValidator.validate(pdf);
            if (!structure.isValid()) {
                logger.info("qpdf reported structural problems in job {}", jobId);
            }
            issues = issues.plus(structure.getIssues());
        } else {
            issues = issues.plus(Issue.toolMissing(Tool.QPDF.key()));
        }

        progress.accept("Extracting metadata");
        if (tools.isAvailable(Tool.PDFINFO)) {
            PdfMetadata metadata = metadataExtractor.extract(pdf);
            analysis.setPageCount(metadata.getPageCount());
            analysis.setPageSizes(metadata.getPageSizes());
            issues = issues.plus(metadata.getIssues());
        } else {
            issues = issues.plus(Issue.toolMissing(Tool.PDFINFO.key()));
        }

        recordDpiFinding(jobId, normalization.getMetadata());

        progress.accept("Checking fonts");
        if (tools.isAvailable(Tool.PDFFONTS)) {
            FontReport fonts = fontInspector.inspect(pdf);
            if (fonts.getAllEmbedded() != null) {
                analysis.recordFontsEmbedded(fonts.getAllEmbedded());
            }
            issues = issues.plus(fonts.getIssues());
        } else {
            issues = issues.plus(Issue.toolMissing(Tool.PDFFONTS.key()));
        }

        progress.accept("Rendering proof");
        boolean proofStored = false;
        if (tools.isAvailable(Tool.PDFTOCAIRO)) {
            try {
                outputAdapter.storeOutput(jobId, OutputKind.PROOF_PNG, proofRenderer.renderProof(pdf));
                proofStored = true;
            } catch (ToolExecutionException | PrepressException e) {
                logger.warn("Proof render failed for job {}: {}", jobId, e.getMessage());
                issues = issues.plus(Issue.warning("PROOF_RENDER_FAILED",
                        "Failed to render proof image: " + e.getMessage()));
            }
        } else {
            issues = issues.plus(Issue.toolMissing(Tool.PDFTOCAIRO.key()));
        }

        FixResult fix = null;
        boolean fixedStored = false;
        if (fixRequested) {
            progress.accept("Applying automatic fixes");
            if (tools.isAvailable(Tool.GHOSTSCRIPT)) {
                ScoreSnapshot before = ScoreSnapshot.of(issues);
                try {
                    byte[] fixed = pdfRepairer.repair(pdf);
                    outputAdapter.storeOutput(jobId, OutputKind.FIXED_PDF, fixed);
                    fixedStored = true;
                    ScoreSnapshot after = ScoreSnapshot.of(reanalyze(fixed, tools));
                    fix = new FixResult(before, after, List.of(PdfRepairer.APPLIED_FIX));
                    recordFix(jobId, issues, before, after);
                    logger.info("Auto-fix complete for job {}. Score: {} -> {}", jobId, before.getScore(), after.getScore());
                } catch (ToolExecutionException | PrepressException e) {
                    logger.warn("Auto-fix failed for job {}: {}", jobId, e.getMessage());
                    issues = issues.plus(Issue.warning("AUTO_FIX_FAILED", "Auto-fix failed: " + e.getMessage()));
                }
            } else {
                issues = issues
                        .plus(Issue.toolMissing(Tool.GHOSTSCRIPT.key()))
                        .plus(Issue.warning("AUTO_FIX_UNAVAILABLE", "Auto-fix requested but Ghostscript is not available"));
            }
        }

        progress.accept("Writing report");
        PrepressReport report = buildReport(job, tools, normalization, issues, analysis, fix);
        storeReport(jobId, report);
        return new PipelineOutcome(report, manifest(proofStored, fixRequested, fixedStored));
    }

    /**
     * Structural and font checks against the repaired file, scored on their own.
     */
    private Issues reanalyze(byte[] fixed, ToolchainStatus tools) {
        Issues after = Issues.empty();
        if (tools.isAvailable(Tool.QPDF)) {
            after = after.plus(structureValidator.validate(fixed).getIssues());
        }
        if (tools.isAvailable(Tool.PDFFONTS)) {
            after = after.plus(fontInspector.inspect(fixed).getIssues());
        }
        return after;
    }

    private void recordDpiFinding(UUID jobId, ImageMetadata metadata) {
        if (metadata == null || metadata.getDpi() == null) {
            return;
        }
        int detected = metadata.getDpi();
        int required = properties.getRequiredDpi();
        if (detected >= required) {
            return;
        }
        try {
            findingsService.logMissingDpi(jobId, detected, required,
                    "Image DPI (" + detected + ") is below recommended " + required + " DPI");
            logger.info("Logged missing DPI finding for job {}", jobId);
        } catch (RuntimeException e) {
            logger.error("Failed to log DPI finding for job {}", jobId, e);
        }
    }

    private void recordFix(UUID jobId, Issues before, ScoreSnapshot beforeScore, ScoreSnapshot afterScore) {
        Map<String, Object> beforeSnapshot = new LinkedHashMap<>();
        beforeSnapshot.put("tool", "original");
        beforeSnapshot.put("issues", before.size());
        beforeSnapshot.put("score", beforeScore.getScore());
        Map<String, Object> afterSnapshot = new LinkedHashMap<>();
        afterSnapshot.put("tool", "ghostscript");
        afterSnapshot.put("settings", PdfRepairer.SETTINGS);
        afterSnapshot.put("score", afterScore.getScore());
        try {
            findingsService.logFix(jobId, FixType.PDF_NORMALIZE,
                    "Normalized PDF via Ghostscript with " + PdfRepairer.SETTINGS + " settings",
                    null, beforeSnapshot, afterSnapshot);
        } catch (RuntimeException e) {
            logger.error("Failed to log fix action for job {}", jobId, e);
        }
    }

    private PrepressReport buildReport(PrepressJob job, ToolchainStatus tools, NormalizationResult normalization,
                                       Issues issues, PrepressAnalysis analysis, FixResult fix) {
        return PrepressReport.builder()
                .jobId(job.getId())
                .mode(job.getMode())
                .timestamp(clock.instant())
                .input(new PrepressReport.Input(job.getOriginalFilename(), job.getSizeBytes(), analysis.getPageCount()))
                .summary(ScoreSnapshot.of(issues))
                .issues(issues.asList())
                .analysis(analysis)
                .toolAvailability(tools.availabilityByKey())
                .toolVersions(tools.versionsByKey())
                .normalization(normalization.toInfo())
                .fix(fix)
                .build();
    }

    private void storeReport(UUID jobId, PrepressReport report) {
        byte[] json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new PrepressException("REPORT_SERIALIZATION_FAILED", "Failed to serialize report for job " + jobId, e);
        }
        outputAdapter.storeOutput(jobId, OutputKind.REPORT_JSON, json);
    }

    private static OutputManifest manifest(boolean proofStored, boolean fixRequested, boolean fixedStored) {
        return OutputManifest.builder()
                .reportJson(true)
                .proofPng(proofStored)
                .fixedPdf(fixRequested ? fixedStored : null)
                .build();
    }
}
