package com.titan.prepress.storage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum OutputKind {
    REPORT_JSON("report.json", "application/json"),
    PROOF_PNG("proof.png", "image/png"),
    FIXED_PDF("fixed.pdf", "application/pdf");

    private final String fileName;
    private final String contentType;

    OutputKind(String fileName, String contentType) {
        this.fileName = fileName;
        this.contentType = contentType;
    }

    public String fileName() {
        return fileName;
    }

    public String contentType() {
        return contentType;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Download name, e.g. {@code <jobId>-report.json}. */
    public String downloadName(Object jobId) {
        return jobId + "-" + fileName;
    }

    public static Optional<OutputKind> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName().equalsIgnoreCase(value))
                .findFirst();
    }
}
