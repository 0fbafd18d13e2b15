package com.titan.prepress.toolchain;

import com.titan.prepress.report.Issues;
import com.titan.prepress.report.PageSize;
import lombok.Value;

import java.util.List;

@Value
public class PdfMetadata {
    int pageCount;
    /** pdfinfo only reports a size when all pages share it, so this holds at most one entry. */
    List<PageSize> pageSizes;
    Issues issues;
}
