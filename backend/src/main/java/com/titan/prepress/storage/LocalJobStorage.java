package com.titan.prepress.storage;

import com.titan.prepress.service.PrepressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Temp-filesystem storage keyed solely by job id. Serves as both input and output adapter
 * until remote storage replaces it.
 */
public class LocalJobStorage implements InputAdapter, OutputAdapter {

    private static final Logger logger = LoggerFactory.getLogger(LocalJobStorage.class);

    private final JobPaths paths;

    public LocalJobStorage(JobPaths paths) {
        this.paths = paths;
    }

    public JobPaths paths() {
        return paths;
    }

    public void writeInput(UUID jobId, byte[] content) {
        write(paths.input(jobId), content);
    }

    @Override
    public byte[] fetchInput(UUID jobId) {
        Path input = paths.input(jobId);
        try {
            return Files.readAllBytes(input);
        } catch (NoSuchFileException e) {
            throw new PrepressException("INPUT_MISSING", "Input file not found for job " + jobId);
        } catch (IOException e) {
            throw new PrepressException("STORAGE_ERROR", "Failed to read input for job " + jobId, e);
        }
    }

    @Override
    public void storeOutput(UUID jobId, OutputKind kind, byte[] content) {
        write(paths.output(jobId, kind), content);
        logger.debug("Stored {} ({} bytes) for job {}", kind.wireName(), content.length, jobId);
    }

    public Optional<byte[]> readOutput(UUID jobId, OutputKind kind) {
        Path file = paths.output(jobId, kind);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new PrepressException("STORAGE_ERROR", "Failed to read " + kind.wireName() + " for job " + jobId, e);
        }
    }

    /** Best-effort removal of the scratch input. Returns false when the file could not be deleted. */
    public boolean deleteInput(UUID jobId) {
        try {
            Files.deleteIfExists(paths.input(jobId));
            return true;
        } catch (IOException e) {
            logger.warn("Failed to delete input for job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    public void deleteJobDirectory(UUID jobId) throws IOException {
        FileSystemUtils.deleteRecursively(paths.jobDir(jobId));
    }

    private void write(Path target, byte[] content) {
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new PrepressException("STORAGE_ERROR", "Failed to write " + target.getFileName(), e);
        }
    }
}
