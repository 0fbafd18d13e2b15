package com.titan.prepress.storage;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Derives every on-disk location from the temp root and the job id. Nothing here is persisted.
 */
public final class JobPaths {

    static final String INPUT_FILE = "input.pdf";
    static final String OUTPUT_DIR = "output";

    private final Path tempRoot;

    public JobPaths(Path tempRoot) {
        this.tempRoot = tempRoot.toAbsolutePath().normalize();
    }

    public Path jobDir(UUID jobId) {
        return tempRoot.resolve(jobId.toString());
    }

    public Path input(UUID jobId) {
        return jobDir(jobId).resolve(INPUT_FILE);
    }

    public Path outputDir(UUID jobId) {
        return jobDir(jobId).resolve(OUTPUT_DIR);
    }

    public Path output(UUID jobId, OutputKind kind) {
        return outputDir(jobId).resolve(kind.fileName());
    }
}
