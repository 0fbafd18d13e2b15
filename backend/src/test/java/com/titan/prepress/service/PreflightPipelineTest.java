package com.titan.prepress.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.titan.prepress.config.PrepressProperties;
import com.titan.prepress.model.FixType;
import com.titan.prepress.model.JobMode;
import com.titan.prepress.model.JobStatus;
import com.titan.prepress.model.OutputManifest;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.report.Issue;
import com.titan.prepress.storage.JobPaths;
import com.titan.prepress.storage.LocalJobStorage;
import com.titan.prepress.storage.OutputAdapter;
import com.titan.prepress.storage.OutputKind;
import com.titan.prepress.toolchain.FakeToolRunner;
import com.titan.prepress.toolchain.FontInspector;
import com.titan.prepress.toolchain.FormatNormalizer;
import com.titan.prepress.toolchain.PdfMetadataExtractor;
import com.titan.prepress.toolchain.PdfRepairer;
import com.titan.prepress.toolchain.ProofRenderer;
import com.titan.prepress.toolchain.StructureValidator;
import com.titan.prepress.toolchain.Tool;
import com.titan.prepress.toolchain.ToolDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PreflightPipelineTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10};

    @TempDir
    Path tempRoot;

    @Mock
    private FindingsService findingsService;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final List<String> progress = new ArrayList<>();

    private LocalJobStorage storage;
    private FakeToolRunner tools;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        storage = new LocalJobStorage(new JobPaths(tempRoot));
        tools = new FakeToolRunner();
    }

    private PreflightPipeline pipeline() {
        return pipeline(storage);
    }

    private PreflightPipeline pipeline(OutputAdapter outputs) {
        return new PreflightPipeline(
                new ToolDetector(tools, 1000, Runnable::run),
                storage,
                outputs,
                new FormatNormalizer(tools),
                new StructureValidator(tools),
                new PdfMetadataExtractor(tools),
                new FontInspector(tools),
                new ProofRenderer(tools),
                new PdfRepairer(tools),
                findingsService,
                objectMapper,
                new PrepressProperties(),
                clock);
    }

    private PrepressJob job(JobMode mode, String filename, String contentType, byte[] content) {
        PrepressJob job = new PrepressJob();
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.RUNNING);
        job.setMode(mode);
        job.setOriginalFilename(filename);
        job.setContentType(contentType);
        job.setSizeBytes(content.length);
        storage.writeInput(job.getId(), content);
        return job;
    }

    private JsonNode storedReport(PrepressJob job) throws Exception {
        return objectMapper.readTree(storage.readOutput(job.getId(), OutputKind.REPORT_JSON).orElseThrow());
    }

    private static boolean hasIssue(JsonNode report, String code) {
        for (JsonNode issue : report.get("issues")) {
            if (issue.get("code").asText().equals(code)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasToolMissing(JsonNode report, Tool tool) {
        for (JsonNode issue : report.get("issues")) {
            if (issue.get("code").asText().equals(Issue.TOOL_MISSING)
                    && issue.get("meta").get("tool").asText().equals(tool.key())) {
                return issue.get("severity").asText().equals("WARNING");
            }
        }
        return false;
    }

    @Test
    void healthyPdfProducesCompleteReport() throws Exception {
        PrepressJob job = job(JobMode.CHECK, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        PipelineOutcome outcome = pipeline().run(job, progress::add);

        JsonNode report = storedReport(job);
        assertEquals("prepress_report_v1", report.get("version").asText());
        assertEquals(job.getId().toString(), report.get("jobId").asText());
        assertEquals("check", report.get("mode").asText());
        assertEquals("2024-05-01T10:00:00Z", report.get("timestamp").asText());
        assertEquals(100.0, report.get("summary").get("score").asDouble());
        assertEquals(0, report.get("summary").get("counts").get("BLOCKER").asInt());
        assertEquals(2, report.get("input").get("pageCount").asInt());
        assertEquals(612.0, report.get("analysis").get("pageSizes").get(0).get("width").asDouble());
        assertEquals("pt", report.get("analysis").get("pageSizes").get(0).get("unit").asText());
        assertTrue(report.get("analysis").get("fontsEmbedded").asBoolean());
        assertEquals("not_analyzed", report.get("analysis").get("images").asText());
        assertEquals("not_analyzed", report.get("analysis").get("colorSpace").asText());
        assertTrue(report.get("toolAvailability").get("ghostscript").asBoolean());
        assertEquals("qpdf version 1.0", report.get("toolVersions").get("qpdf").asText());
        assertFalse(report.has("fix"));

        OutputManifest manifest = outcome.getManifest();
        assertTrue(manifest.isReportJson());
        assertTrue(manifest.isProofPng());
        assertNull(manifest.getFixedPdf());
        assertTrue(storage.readOutput(job.getId(), OutputKind.PROOF_PNG).isPresent());
        assertEquals(2, outcome.summary().getPageCount());
        assertFalse(progress.isEmpty());
    }

    @ParameterizedTest
    @EnumSource(Tool.class)
    void missingToolDegradesToWarning(Tool missing) throws Exception {
        tools.without(missing);
        PrepressJob job = missing == Tool.IMAGEMAGICK
                ? job(JobMode.CHECK, "photo.jpg", "image/jpeg", JPEG.clone())
                : job(JobMode.CHECK_AND_FIX, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        PipelineOutcome outcome = assertDoesNotThrow(() -> pipeline().run(job, progress::add));

        JsonNode report = storedReport(job);
        assertTrue(hasToolMissing(report, missing), "expected TOOL_MISSING for " + missing.key());
        assertFalse(report.get("toolAvailability").get(missing.key()).asBoolean());
        assertNotNull(report.get("summary").get("score"));
        assertEquals(outcome.getReport().getSummary().getScore(), report.get("summary").get("score").asDouble());
    }

    @Test
    void pdfWithoutAnyToolIsPassedThroughUntouched() throws Exception {
        tools.withoutAnyTool();
        byte[] pdf = FakeToolRunner.pdf("original");
        PrepressJob job = job(JobMode.CHECK, "flyer.pdf", "application/pdf", pdf);

        PipelineOutcome outcome = pipeline().run(job, progress::add);

        JsonNode report = storedReport(job);
        assertEquals("pdf", report.get("normalization").get("originalFormat").asText());
        assertEquals("pdf", report.get("normalization").get("normalizedFormat").asText());
        assertEquals("unknown", report.get("analysis").get("fontsEmbedded").asText());
        assertFalse(outcome.getManifest().isProofPng());
        // qpdf, pdfinfo, pdffonts and pdftocairo are each reported once
        assertEquals(4, outcome.getReport().getSummary().getCounts().getWarning());
        assertEquals(92.0, outcome.getReport().getSummary().getScore());
    }

    @Test
    void normalizedBytesReachTheChecksUnchanged() {
        byte[] pdf = FakeToolRunner.pdf("original");
        PrepressJob job = job(JobMode.CHECK, "flyer.pdf", "application/pdf", pdf);

        pipeline().run(job, progress::add);

        assertFalse(tools.analyzedPdfs().isEmpty());
        for (byte[] analyzed : tools.analyzedPdfs()) {
            assertArrayEquals(pdf, analyzed);
        }
    }

    @Test
    void checkAndFixWithoutGhostscriptHasNoFixBlock() throws Exception {
        tools.without(Tool.GHOSTSCRIPT);
        PrepressJob job = job(JobMode.CHECK_AND_FIX, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        PipelineOutcome outcome = pipeline().run(job, progress::add);

        JsonNode report = storedReport(job);
        assertFalse(report.has("fix"));
        assertTrue(hasToolMissing(report, Tool.GHOSTSCRIPT));
        assertTrue(hasIssue(report, "AUTO_FIX_UNAVAILABLE"));
        assertEquals(Boolean.FALSE, outcome.getManifest().getFixedPdf());
        verify(findingsService, never()).logFix(any(), any(), any(), any(), any(), any());
    }

    @Test
    void checkAndFixWithGhostscriptScoresBeforeAndAfter() throws Exception {
        tools.pdfFontsOutput(FakeToolRunner.PDFFONTS_HEADER
                + "Helvetica                            Type 1            Standard         no  no  no       5  0\n");
        PrepressJob job = job(JobMode.CHECK_AND_FIX, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        PipelineOutcome outcome = pipeline().run(job, progress::add);

        JsonNode fix = storedReport(job).get("fix");
        assertNotNull(fix);
        assertEquals(98.0, fix.get("before").get("score").asDouble());
        assertEquals(1, fix.get("before").get("counts").get("WARNING").asInt());
        assertTrue(fix.get("after").has("score"));
        assertTrue(fix.get("after").has("counts"));
        assertEquals("normalize_via_ghostscript", fix.get("applied").get(0).asText());
        assertEquals(Boolean.TRUE, outcome.getManifest().getFixedPdf());
        assertArrayEquals(FakeToolRunner.pdf("repaired"), storage.readOutput(job.getId(), OutputKind.FIXED_PDF).orElseThrow());
        verify(findingsService).logFix(eq(job.getId()), eq(FixType.PDF_NORMALIZE), anyString(), isNull(), anyMap(), anyMap());
    }

    @Test
    void repairFailureIsReportedWithoutFixBlock() throws Exception {
        tools.failing(Tool.GHOSTSCRIPT);
        PrepressJob job = job(JobMode.CHECK_AND_FIX, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        PipelineOutcome outcome = pipeline().run(job, progress::add);

        JsonNode report = storedReport(job);
        assertFalse(report.has("fix"));
        assertTrue(hasIssue(report, "AUTO_FIX_FAILED"));
        assertEquals(98.0, report.get("summary").get("score").asDouble());
        assertEquals(Boolean.FALSE, outcome.getManifest().getFixedPdf());
    }

    @Test
    void repairThatIsNotAPdfCountsAsFailure() throws Exception {
        tools.repairedPdf("garbage".getBytes());
        PrepressJob job = job(JobMode.CHECK_AND_FIX, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        pipeline().run(job, progress::add);

        assertTrue(hasIssue(storedReport(job), "AUTO_FIX_FAILED"));
        assertTrue(storage.readOutput(job.getId(), OutputKind.FIXED_PDF).isEmpty());
    }

    @Test
    void lowResolutionJpegIsNormalizedAndRecorded() throws Exception {
        tools.identifyOutput("800 600 72 CMYK");
        PrepressJob job = job(JobMode.CHECK, "test.jpg", "image/jpeg", JPEG.clone());

        pipeline().run(job, progress::add);

        JsonNode report = storedReport(job);
        JsonNode normalization = report.get("normalization");
        assertEquals("jpg", normalization.get("originalFormat").asText());
        assertEquals("pdf", normalization.get("normalizedFormat").asText());
        assertEquals(72, normalization.get("metadata").get("dpi").asInt());
        assertTrue(hasIssue(report, "LOW_DPI"));
        verify(findingsService).logMissingDpi(eq(job.getId()), eq(72), eq(300), anyString());
    }

    @Test
    void findingFailureDoesNotStopThePipeline() throws Exception {
        tools.identifyOutput("800 600 72 CMYK");
        when(findingsService.logMissingDpi(any(), anyInt(), anyInt(), anyString()))
                .thenThrow(new IllegalStateException("database unavailable"));
        PrepressJob job = job(JobMode.CHECK, "test.jpg", "image/jpeg", JPEG.clone());

        assertDoesNotThrow(() -> pipeline().run(job, progress::add));
        assertTrue(hasIssue(storedReport(job), "LOW_DPI"));
    }

    @Test
    void unsupportedUploadSkipsPdfChecks() throws Exception {
        PrepressJob job = job(JobMode.CHECK_AND_FIX, "notes.txt", "text/plain", "just text".getBytes());

        PipelineOutcome outcome = pipeline().run(job, progress::add);

        JsonNode report = storedReport(job);
        assertTrue(hasIssue(report, "UNSUPPORTED_FORMAT"));
        assertEquals("unknown", report.get("normalization").get("originalFormat").asText());
        assertFalse(report.get("normalization").has("normalizedFormat"));
        assertEquals(90.0, report.get("summary").get("score").asDouble());
        assertEquals(0, report.get("input").get("pageCount").asInt());
        assertTrue(tools.analyzedPdfs().isEmpty());
        assertFalse(outcome.getManifest().isProofPng());
        assertEquals(Boolean.FALSE, outcome.getManifest().getFixedPdf());
    }

    @Test
    void brokenRendererOnlyWarns() throws Exception {
        tools.proofPng("not a png".getBytes());
        PrepressJob job = job(JobMode.CHECK, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        PipelineOutcome outcome = pipeline().run(job, progress::add);

        assertTrue(hasIssue(storedReport(job), "PROOF_RENDER_FAILED"));
        assertFalse(outcome.getManifest().isProofPng());
    }

    @Test
    void proofStorageFailureOnlyWarns() throws Exception {
        OutputAdapter noRoomForProofs = (jobId, kind, content) -> {
            if (kind == OutputKind.PROOF_PNG) {
                throw new PrepressException("STORAGE_ERROR", "Disk full");
            }
            storage.storeOutput(jobId, kind, content);
        };
        PrepressJob job = job(JobMode.CHECK, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));

        PipelineOutcome outcome = pipeline(noRoomForProofs).run(job, progress::add);

        JsonNode report = storedReport(job);
        assertTrue(hasIssue(report, "PROOF_RENDER_FAILED"));
        assertTrue(outcome.getManifest().isReportJson());
        assertFalse(outcome.getManifest().isProofPng());
        assertTrue(storage.readOutput(job.getId(), OutputKind.PROOF_PNG).isEmpty());
    }

    @Test
    void missingInputEscapesAsProcessingError() {
        PrepressJob job = job(JobMode.CHECK, "flyer.pdf", "application/pdf", FakeToolRunner.pdf("flyer"));
        storage.deleteInput(job.getId());

        PrepressException e = assertThrows(PrepressException.class, () -> pipeline().run(job, progress::add));
        assertEquals("INPUT_MISSING", e.getCode());
    }
}
