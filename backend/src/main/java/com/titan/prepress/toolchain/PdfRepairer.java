package com.titan.prepress.toolchain;

/**
 * Safe repair pass: rewrites the PDF through Ghostscript with prepress settings, forcing font
 * embedding, keeping color spaces, targeting PDF 1.4 and never auto-rotating pages.
 */
public class PdfRepairer {

    public static final String APPLIED_FIX = "normalize_via_ghostscript";
    public static final String SETTINGS = "/prepress";

    private final ToolRunner toolRunner;

    public PdfRepairer(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    /**
     * @throws ToolExecutionException when Ghostscript fails or produces something that is not a PDF
     */
    public byte[] repair(byte[] pdf) {
        byte[] fixed = toolRunner.repairPdf(pdf);
        if (!FormatDetector.startsWith(fixed, FormatDetector.PDF_MAGIC)) {
            throw new ToolExecutionException("Ghostscript output is not a PDF");
        }
        return fixed;
    }
}
