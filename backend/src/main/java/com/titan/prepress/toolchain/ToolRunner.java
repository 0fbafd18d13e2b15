package com.titan.prepress.toolchain;

/**
 * One method per external tool invocation. Implementations run each call in isolation
 * with a timeout and a bounded output buffer.
 * <p>
 * Every method throws {@link ToolExecutionException} when the tool cannot be launched,
 * times out, or (unless stated otherwise) exits with a non-zero status.
 */
public interface ToolRunner {

    /**
     * Version probe. Returns the raw probe output; used by the detector to decide availability.
     */
    ToolOutput version(Tool tool, long timeoutMs);

    /**
     * {@code qpdf --check}. Non-zero exits are returned, not thrown: qpdf uses 2 for errors
     * and 3 for warnings.
     */
    ToolOutput checkStructure(byte[] pdf);

    /** {@code pdfinfo} stdout. */
    String pdfInfo(byte[] pdf);

    /** {@code pdffonts} stdout. */
    String pdfFonts(byte[] pdf);

    /** Ghostscript pdfwrite pass producing a repaired PDF. */
    byte[] repairPdf(byte[] pdf);

    /** Renders a single page to PNG. */
    byte[] renderPage(byte[] pdf, int page, int dpi);

    /** ImageMagick {@code identify -format "%w %h %x %[colorspace]"} on the first frame. */
    String identifyImage(byte[] image, String extension);

    /**
     * ImageMagick conversion to PDF. With {@code flatten} only the composite first layer is used.
     */
    byte[] convertToPdf(byte[] image, String extension, boolean flatten);
}
