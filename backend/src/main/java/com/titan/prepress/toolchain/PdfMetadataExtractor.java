package com.titan.prepress.toolchain;

import com.titan.prepress.report.Issue;
import com.titan.prepress.report.Issues;
import com.titan.prepress.report.PageSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PdfMetadataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PdfMetadataExtractor.class);

    static final String PDFINFO_FAILED = "PDFINFO_FAILED";

    private static final Pattern PAGES = Pattern.compile("^Pages:\\s+(\\d+)");
    private static final Pattern PAGE_SIZE = Pattern.compile("^Page size:\\s+([\\d.]+)\\s+x\\s+([\\d.]+)\\s+pts");

    private final ToolRunner toolRunner;

    public PdfMetadataExtractor(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    public PdfMetadata extract(byte[] pdf) {
        String stdout;
        try {
            stdout = toolRunner.pdfInfo(pdf);
        } catch (ToolExecutionException e) {
            logger.warn("pdfinfo failed: {}", e.getMessage());
            return new PdfMetadata(0, List.of(),
                    Issues.empty().plus(Issue.warning(PDFINFO_FAILED, "pdfinfo failed: " + e.getMessage())));
        }
        return parse(stdout);
    }

    static PdfMetadata parse(String stdout) {
        int pageCount = 0;
        List<PageSize> pageSizes = new ArrayList<>();
        for (String line : stdout.split("\\R")) {
            String trimmed = line.trim();
            Matcher pages = PAGES.matcher(trimmed);
            if (pages.find()) {
                pageCount = Integer.parseInt(pages.group(1));
                continue;
            }
            Matcher size = PAGE_SIZE.matcher(trimmed);
            if (size.find()) {
                pageSizes.add(PageSize.points(Double.parseDouble(size.group(1)), Double.parseDouble(size.group(2))));
            }
        }
        return new PdfMetadata(pageCount, List.copyOf(pageSizes), Issues.empty());
    }
}
