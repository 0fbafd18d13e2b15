package com.titan.prepress.toolchain;

import com.titan.prepress.report.Issues;
import lombok.Value;

@Value
public class FontReport {
    /** null when the font list could not be read. */
    Boolean allEmbedded;
    Issues issues;
}
