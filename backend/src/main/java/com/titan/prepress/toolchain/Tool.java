package com.titan.prepress.toolchain;

import java.util.List;

/**
 * The optional external binaries the preflight pipeline relies on.
 */
public enum Tool {
    QPDF("qpdf", "qpdf", "--version"),
    PDFINFO("pdfinfo", "pdfinfo", "-v"),
    PDFFONTS("pdffonts", "pdffonts", "-v"),
    GHOSTSCRIPT("ghostscript", "gs", "--version"),
    PDFTOCAIRO("pdftocairo", "pdftocairo", "-v"),
    IMAGEMAGICK("imagemagick", "convert", "--version");

    private final String key;
    private final String defaultCommand;
    private final String versionFlag;

    Tool(String key, String defaultCommand, String versionFlag) {
        this.key = key;
        this.defaultCommand = defaultCommand;
        this.versionFlag = versionFlag;
    }

    /** Name used in reports and configuration. */
    public String key() {
        return key;
    }

    public String defaultCommand() {
        return defaultCommand;
    }

    public List<String> versionArgs() {
        return List.of(versionFlag);
    }
}
