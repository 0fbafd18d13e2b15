package com.titan.prepress.toolchain;

import com.titan.prepress.report.Issue;
import com.titan.prepress.report.Issues;
import com.titan.prepress.report.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Structural sanity check via {@code qpdf --check}. Reported errors and invocation failures
 * are BLOCKERs since nothing downstream can be trusted on a broken file.
 */
public class StructureValidator {

    private static final Logger logger = LoggerFactory.getLogger(StructureValidator.class);

    static final String QPDF_ERROR = "QPDF_ERROR";
    static final String QPDF_WARNING = "QPDF_WARNING";
    static final String QPDF_FAILED = "QPDF_FAILED";

    private static final int EXIT_WARNINGS = 3;

    private final ToolRunner toolRunner;

    public StructureValidator(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    public StructureCheck validate(byte[] pdf) {
        ToolOutput output;
        try {
            output = toolRunner.checkStructure(pdf);
        } catch (ToolExecutionException e) {
            logger.warn("qpdf check failed: {}", e.getMessage());
            return new StructureCheck(false, Issues.empty().plus(Issue.builder()
                    .severity(Severity.BLOCKER)
                    .code(QPDF_FAILED)
                    .message("QPDF validation failed: " + e.getMessage())
                    .build()));
        }

        Issues issues = Issues.empty();
        boolean valid = true;
        for (String line : output.getStderr().split("\\R")) {
            String trimmed = line.trim();
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (lower.contains("error")) {
                valid = false;
                issues = issues.plus(Issue.blocker(QPDF_ERROR, trimmed));
            } else if (lower.contains("warning")) {
                issues = issues.plus(Issue.warning(QPDF_WARNING, trimmed));
            }
        }

        int exit = output.getExitCode();
        if (valid && exit != 0 && exit != EXIT_WARNINGS) {
            valid = false;
            issues = issues.plus(Issue.builder()
                    .severity(Severity.BLOCKER)
                    .code(QPDF_FAILED)
                    .message("QPDF validation failed with exit code " + exit)
                    .metaEntry("exitCode", exit)
                    .build());
        }
        return new StructureCheck(valid, issues);
    }
}
