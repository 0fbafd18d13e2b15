package com.titan.prepress.toolchain;

import com.titan.prepress.report.ImageMetadata;
import com.titan.prepress.report.Issue;
import com.titan.prepress.report.Issues;
import com.titan.prepress.report.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns any supported upload into a PDF for the downstream checks. Never throws: every failure
 * is reported as an issue and leaves the result without a PDF.
 */
public class FormatNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(FormatNormalizer.class);

    static final int RECOMMENDED_DPI = 300;
    static final int MINIMUM_DPI = 150;
    private static final double CM_PER_INCH = 2.54;

    private final ToolRunner toolRunner;

    public FormatNormalizer(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    public NormalizationResult normalize(byte[] content, String mimeType, String filename, ToolchainStatus tools) {
        FileFormat format = FormatDetector.detect(content, mimeType, filename);
        logger.info("Detected format {} for '{}'", format.wireName(), filename);
        try {
            return switch (format) {
                case PDF -> NormalizationResult.builder()
                        .originalFormat(FileFormat.PDF)
                        .normalizedPdf(content)
                        .notes(List.of("PDF file, no normalization needed"))
                        .issues(Issues.empty())
                        .build();
                case AI -> normalizeIllustrator(content);
                case JPG, PNG, TIFF -> normalizeRaster(content, format, tools);
                case PSD -> normalizePhotoshop(content, tools);
                case UNKNOWN -> unsupported(filename);
            };
        } catch (RuntimeException e) {
            logger.error("Normalization of '{}' failed unexpectedly", filename, e);
            return failed(format, new ArrayList<>(), Issues.empty(), null,
                    Issue.blocker("NORMALIZATION_FAILED", "Failed to normalize file: " + e.getMessage()));
        }
    }

    private NormalizationResult normalizeIllustrator(byte[] content) {
        return NormalizationResult.builder()
                .originalFormat(FileFormat.AI)
                .normalizedPdf(content)
                .notes(List.of("Adobe Illustrator file (PDF-based) passed through for preflight"))
                .issues(Issues.empty().plus(Issue.builder()
                        .severity(Severity.INFO)
                        .code("AI_FILE_DETECTED")
                        .message("Adobe Illustrator file detected. File will be processed as PDF.")
                        .metaEntry("note", "For best results, export as PDF/X-4 from Illustrator before upload")
                        .build()))
                .build();
    }

    private NormalizationResult normalizeRaster(byte[] content, FileFormat format, ToolchainStatus tools) {
        List<String> notes = new ArrayList<>();
        String label = format.wireName().toUpperCase(Locale.ROOT);
        if (!tools.isAvailable(Tool.IMAGEMAGICK)) {
            notes.add("ImageMagick not available, conversion skipped");
            return failed(format, notes, Issues.empty().plus(Issue.toolMissing(Tool.IMAGEMAGICK.key())), null,
                    conversionFailure("NORMALIZATION_FAILED",
                            "Failed to convert " + label + " to PDF. ImageMagick is not installed.",
                            "Install ImageMagick or upload a PDF file instead", null));
        }

        Issues issues = Issues.empty();
        ImageMetadata metadata = identify(content, format, notes);
        if (metadata != null) {
            issues = issues.plus(resolutionIssues(metadata));
            if (metadata.getColorSpace() != null
                    && metadata.getColorSpace().toLowerCase(Locale.ROOT).contains("rgb")) {
                issues = issues.plus(Issue.builder()
                        .severity(Severity.INFO)
                        .code("RGB_COLORSPACE")
                        .message("Image is in RGB color space. CMYK is preferred for print.")
                        .metaEntry("colorSpace", metadata.getColorSpace())
                        .build());
            }
        }

        try {
            byte[] pdf = toolRunner.convertToPdf(content, format.wireName(), false);
            notes.add("Converted to PDF using ImageMagick");
            return NormalizationResult.builder()
                    .originalFormat(format)
                    .normalizedPdf(pdf)
                    .notes(List.copyOf(notes))
                    .issues(issues)
                    .metadata(metadata)
                    .build();
        } catch (ToolExecutionException e) {
            logger.warn("ImageMagick conversion of {} failed: {}", label, e.getMessage());
            notes.add("ImageMagick conversion failed");
            return failed(format, notes, issues, metadata, conversionFailure("NORMALIZATION_FAILED",
                    "Failed to convert " + label + " to PDF.",
                    "Install ImageMagick or upload a PDF file instead", e));
        }
    }

    private NormalizationResult normalizePhotoshop(byte[] content, ToolchainStatus tools) {
        List<String> notes = new ArrayList<>();
        Issues issues = Issues.empty();
        String suggestion = "Flatten layers and export as PDF, TIFF, or JPG from Photoshop";
        if (!tools.isAvailable(Tool.IMAGEMAGICK)) {
            notes.add("ImageMagick not available, PSD conversion skipped");
            return failed(FileFormat.PSD, notes, issues.plus(Issue.toolMissing(Tool.IMAGEMAGICK.key())), null,
                    conversionFailure("PSD_NORMALIZATION_FAILED",
                            "Failed to convert PSD to PDF. ImageMagick is not installed.", suggestion, null));
        }
        try {
            byte[] pdf = toolRunner.convertToPdf(content, FileFormat.PSD.wireName(), true);
            notes.add("Converted to PDF using ImageMagick (flattened to single layer)");
            return NormalizationResult.builder()
                    .originalFormat(FileFormat.PSD)
                    .normalizedPdf(pdf)
                    .notes(List.copyOf(notes))
                    .issues(issues.plus(Issue.builder()
                            .severity(Severity.WARNING)
                            .code("PSD_FLATTENED")
                            .message("PSD file was flattened to a single layer during conversion. Layer information was lost.")
                            .metaEntry("suggestion", "For better control, flatten and export as PDF or TIFF from Photoshop before upload")
                            .build()))
                    .build();
        } catch (ToolExecutionException e) {
            logger.warn("ImageMagick PSD conversion failed: {}", e.getMessage());
            notes.add("ImageMagick PSD conversion failed");
            return failed(FileFormat.PSD, notes, issues, null, conversionFailure("PSD_NORMALIZATION_FAILED",
                    "Failed to convert PSD to PDF. The PSD format may be unsupported.", suggestion, e));
        }
    }

    private NormalizationResult unsupported(String filename) {
        return failed(FileFormat.UNKNOWN, List.of("Unknown format for '" + filename + "'"),
                Issues.empty(), null, Issue.builder()
                        .severity(Severity.BLOCKER)
                        .code("UNSUPPORTED_FORMAT")
                        .message("File format of '" + filename + "' is not supported")
                        .metaEntry("suggestion", "Please upload PDF, JPG, PNG, TIF, AI, or PSD files")
                        .build());
    }

    private ImageMetadata identify(byte[] content, FileFormat format, List<String> notes) {
        try {
            ImageMetadata metadata = parseIdentify(toolRunner.identifyImage(content, format.wireName()));
            if (metadata == null) {
                notes.add("Image metadata not available");
                return null;
            }
            notes.add("Original dimensions: " + metadata.getWidth() + "x" + metadata.getHeight() + "px");
            notes.add(metadata.getDpi() != null ? "DPI: " + metadata.getDpi() : "DPI metadata not available");
            if (metadata.getColorSpace() != null) {
                notes.add("Color space: " + metadata.getColorSpace());
            }
            return metadata;
        } catch (ToolExecutionException e) {
            logger.debug("identify failed: {}", e.getMessage());
            notes.add("Image metadata not available");
            return null;
        }
    }

    private static Issues resolutionIssues(ImageMetadata metadata) {
        Integer dpi = metadata.getDpi();
        if (dpi == null) {
            return Issues.empty();
        }
        if (dpi < MINIMUM_DPI) {
            return Issues.empty().plus(Issue.builder()
                    .severity(Severity.WARNING)
                    .code("LOW_DPI")
                    .message("Image DPI is " + dpi + ", recommended minimum is " + RECOMMENDED_DPI + " for print")
                    .metaEntry("dpi", dpi)
                    .metaEntry("recommended", RECOMMENDED_DPI)
                    .build());
        }
        if (dpi < RECOMMENDED_DPI) {
            return Issues.empty().plus(Issue.builder()
                    .severity(Severity.INFO)
                    .code("MARGINAL_DPI")
                    .message("Image DPI is " + dpi + ", recommended is " + RECOMMENDED_DPI + " for optimal print quality")
                    .metaEntry("dpi", dpi)
                    .metaEntry("recommended", RECOMMENDED_DPI)
                    .build());
        }
        return Issues.empty();
    }

    /**
     * Parses {@code "%w %h %x %[colorspace]"}. Older ImageMagick releases print the resolution
     * with its unit, e.g. {@code "28.35 PixelsPerCentimeter"}.
     */
    static ImageMetadata parseIdentify(String output) {
        String[] parts = output == null ? new String[0] : output.trim().split("\\s+");
        if (parts.length < 4) {
            return null;
        }
        try {
            int width = Integer.parseInt(parts[0]);
            int height = Integer.parseInt(parts[1]);
            double resolution = leadingNumber(parts[2]);
            if (parts.length > 4 && parts[3].equalsIgnoreCase("PixelsPerCentimeter")) {
                resolution *= CM_PER_INCH;
            }
            Integer dpi = resolution > 0 ? (int) Math.round(resolution) : null;
            return ImageMetadata.builder()
                    .width(width)
                    .height(height)
                    .dpi(dpi)
                    .colorSpace(parts[parts.length - 1])
                    .build();
        } catch (NumberFormatException e) {
            logger.debug("Unparseable identify output '{}'", output);
            return null;
        }
    }

    private static double leadingNumber(String token) {
        int end = 0;
        while (end < token.length() && (Character.isDigit(token.charAt(end)) || token.charAt(end) == '.')) {
            end++;
        }
        return end == 0 ? 0 : Double.parseDouble(token.substring(0, end));
    }

    private static Issue conversionFailure(String code, String message, String suggestion, Exception cause) {
        Issue.IssueBuilder builder = Issue.builder()
                .severity(Severity.BLOCKER)
                .code(code)
                .message(message)
                .metaEntry("suggestion", suggestion);
        if (cause != null) {
            builder.metaEntry("error", cause.getMessage());
        }
        return builder.build();
    }

    private static NormalizationResult failed(FileFormat format, List<String> notes, Issues issues,
                                              ImageMetadata metadata, Issue blocker) {
        return NormalizationResult.builder()
                .originalFormat(format)
                .notes(List.copyOf(notes))
                .issues(issues.plus(blocker))
                .metadata(metadata)
                .build();
    }
}
