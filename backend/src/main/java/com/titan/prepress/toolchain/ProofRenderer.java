package com.titan.prepress.toolchain;

public class ProofRenderer {

    public static final int PROOF_PAGE = 1;
    public static final int PROOF_DPI = 150;

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};

    private final ToolRunner toolRunner;

    public ProofRenderer(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    /**
     * Renders the first page as a PNG proof.
     *
     * @throws ToolExecutionException when rendering fails or the result is not a PNG
     */
    public byte[] renderProof(byte[] pdf) {
        byte[] png = toolRunner.renderPage(pdf, PROOF_PAGE, PROOF_DPI);
        if (!FormatDetector.startsWith(png, PNG_SIGNATURE)) {
            throw new ToolExecutionException("pdftocairo did not produce a PNG image");
        }
        return png;
    }
}
