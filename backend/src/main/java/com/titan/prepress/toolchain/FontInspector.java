package com.titan.prepress.toolchain;

import com.titan.prepress.report.Issue;
import com.titan.prepress.report.Issues;
import com.titan.prepress.report.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Font embedding check over {@code pdffonts} output. The first two lines are the table header.
 * A row ends with the {@code emb sub uni} flags and the two-part object id, so the embedded
 * flag is read counting from the end of the row; type names such as {@code Type 1C} contain
 * spaces. Only a {@code no} in that column is reported.
 */
public class FontInspector {

    private static final Logger logger = LoggerFactory.getLogger(FontInspector.class);

    static final String FONT_NOT_EMBEDDED = "FONT_NOT_EMBEDDED";
    static final String PDFFONTS_FAILED = "PDFFONTS_FAILED";

    private static final int HEADER_LINES = 2;
    // emb, sub, uni, object number, generation
    private static final int TRAILING_COLUMNS = 5;

    private final ToolRunner toolRunner;

    public FontInspector(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    public FontReport inspect(byte[] pdf) {
        String stdout;
        try {
            stdout = toolRunner.pdfFonts(pdf);
        } catch (ToolExecutionException e) {
            logger.warn("pdffonts failed: {}", e.getMessage());
            return new FontReport(null,
                    Issues.empty().plus(Issue.warning(PDFFONTS_FAILED, "pdffonts failed: " + e.getMessage())));
        }
        return parse(stdout);
    }

    static FontReport parse(String stdout) {
        List<String> lines = stdout.lines().filter(line -> !line.isBlank()).toList();
        Issues issues = Issues.empty();
        boolean allEmbedded = true;
        for (String line : lines.subList(Math.min(HEADER_LINES, lines.size()), lines.size())) {
            String[] columns = line.trim().split("\\s+");
            if (columns.length <= TRAILING_COLUMNS) {
                logger.debug("Skipping unexpected pdffonts row: {}", line);
                continue;
            }
            String embedded = columns[columns.length - TRAILING_COLUMNS].toLowerCase(Locale.ROOT);
            if ("no".equals(embedded)) {
                allEmbedded = false;
                String fontName = columns[0];
                issues = issues.plus(Issue.builder()
                        .severity(Severity.WARNING)
                        .code(FONT_NOT_EMBEDDED)
                        .message("Font not fully embedded: " + fontName)
                        .metaEntry("fontName", fontName)
                        .build());
            }
        }
        return new FontReport(allEmbedded, issues);
    }
}
