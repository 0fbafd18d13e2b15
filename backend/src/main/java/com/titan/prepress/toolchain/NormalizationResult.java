package com.titan.prepress.toolchain;

import com.titan.prepress.report.ImageMetadata;
import com.titan.prepress.report.Issues;
import com.titan.prepress.report.NormalizationInfo;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NormalizationResult {

    FileFormat originalFormat;
    /** PDF to analyze; null when none could be produced. */
    byte[] normalizedPdf;
    List<String> notes;
    Issues issues;
    ImageMetadata metadata;

    public boolean hasPdf() {
        return normalizedPdf != null;
    }

    public String normalizedFormat() {
        return hasPdf() ? FileFormat.PDF.wireName() : null;
    }

    public NormalizationInfo toInfo() {
        return NormalizationInfo.builder()
                .originalFormat(originalFormat.wireName())
                .normalizedFormat(normalizedFormat())
                .notes(notes)
                .metadata(metadata)
                .build();
    }
}
