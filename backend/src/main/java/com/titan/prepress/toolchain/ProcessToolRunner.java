package com.titan.prepress.toolchain;

import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.PumpStreamHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs the tools as child processes through Commons Exec. Each invocation gets its own scratch
 * directory which is removed afterwards, whatever the outcome.
 */
public class ProcessToolRunner implements ToolRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessToolRunner.class);

    static final String IDENTIFY_KEY = "identify";
    static final String IDENTIFY_FORMAT = "%w %h %x %[colorspace]";

    private static final List<String> GHOSTSCRIPT_PREPRESS_ARGS = List.of(
            "-dSAFER", "-dBATCH", "-dNOPAUSE", "-dQUIET",
            "-sDEVICE=pdfwrite",
            "-dPDFSETTINGS=/prepress",
            "-dCompatibilityLevel=1.4",
            "-dAutoRotatePages=/None",
            "-dColorConversionStrategy=/LeaveColorUnchanged",
            "-dEmbedAllFonts=true");

    private final long timeoutMs;
    private final int maxOutputBytes;
    private final Map<String, String> binaries;

    public ProcessToolRunner(long timeoutMs, int maxOutputBytes, Map<String, String> binaries) {
        this.timeoutMs = timeoutMs;
        this.maxOutputBytes = maxOutputBytes;
        this.binaries = Map.copyOf(binaries);
    }

    @Override
    public ToolOutput version(Tool tool, long probeTimeoutMs) {
        CommandLine cmd = new CommandLine(executable(tool));
        tool.versionArgs().forEach(cmd::addArgument);
        ToolOutput output = execute(cmd, null, probeTimeoutMs);
        requireSuccess(tool.key(), output);
        return output;
    }

    @Override
    public ToolOutput checkStructure(byte[] pdf) {
        return inScratch("qpdf", dir -> {
            Path input = write(dir, "input.pdf", pdf);
            CommandLine cmd = new CommandLine(executable(Tool.QPDF));
            cmd.addArgument("--check");
            cmd.addArgument(input.toString(), false);
            return execute(cmd, dir, timeoutMs);
        });
    }

    @Override
    public String pdfInfo(byte[] pdf) {
        return stdoutOf(Tool.PDFINFO, pdf);
    }

    @Override
    public String pdfFonts(byte[] pdf) {
        return stdoutOf(Tool.PDFFONTS, pdf);
    }

    @Override
    public byte[] repairPdf(byte[] pdf) {
        return inScratch("gs", dir -> {
            Path input = write(dir, "input.pdf", pdf);
            Path output = dir.resolve("fixed.pdf");
            CommandLine cmd = new CommandLine(executable(Tool.GHOSTSCRIPT));
            GHOSTSCRIPT_PREPRESS_ARGS.forEach(arg -> cmd.addArgument(arg, false));
            cmd.addArgument("-sOutputFile=" + output, false);
            cmd.addArgument(input.toString(), false);
            requireSuccess(Tool.GHOSTSCRIPT.key(), execute(cmd, dir, timeoutMs));
            return readProduced(Tool.GHOSTSCRIPT.key(), output);
        });
    }

    @Override
    public byte[] renderPage(byte[] pdf, int page, int dpi) {
        return inScratch("pdftocairo", dir -> {
            Path input = write(dir, "input.pdf", pdf);
            Path prefix = dir.resolve("proof");
            CommandLine cmd = new CommandLine(executable(Tool.PDFTOCAIRO));
            cmd.addArgument("-png");
            cmd.addArgument("-f").addArgument(String.valueOf(page));
            cmd.addArgument("-l").addArgument(String.valueOf(page));
            cmd.addArgument("-r").addArgument(String.valueOf(dpi));
            cmd.addArgument("-singlefile");
            cmd.addArgument(input.toString(), false);
            cmd.addArgument(prefix.toString(), false);
            requireSuccess(Tool.PDFTOCAIRO.key(), execute(cmd, dir, timeoutMs));
            return readProduced(Tool.PDFTOCAIRO.key(), dir.resolve("proof.png"));
        });
    }

    @Override
    public String identifyImage(byte[] image, String extension) {
        return inScratch("identify", dir -> {
            Path input = write(dir, "input." + extension, image);
            CommandLine cmd = new CommandLine(binaries.getOrDefault(IDENTIFY_KEY, IDENTIFY_KEY));
            cmd.addArgument("-format");
            cmd.addArgument(IDENTIFY_FORMAT, false);
            cmd.addArgument(input + "[0]", false);
            ToolOutput output = execute(cmd, dir, timeoutMs);
            requireSuccess(IDENTIFY_KEY, output);
            return output.stdoutText();
        });
    }

    @Override
    public byte[] convertToPdf(byte[] image, String extension, boolean flatten) {
        return inScratch("convert", dir -> {
            Path input = write(dir, "input." + extension, image);
            Path output = dir.resolve("normalized.pdf");
            CommandLine cmd = new CommandLine(executable(Tool.IMAGEMAGICK));
            if (flatten) {
                cmd.addArgument(input + "[0]", false);
                cmd.addArgument("-flatten");
            } else {
                cmd.addArgument(input.toString(), false);
            }
            cmd.addArgument("-compress").addArgument("Zip");
            cmd.addArgument("-quality").addArgument("95");
            cmd.addArgument(output.toString(), false);
            ToolOutput result = execute(cmd, dir, timeoutMs);
            requireSuccess(Tool.IMAGEMAGICK.key(), result);
            if (!result.getStderr().isBlank()) {
                logger.debug("convert warnings: {}", abbreviate(result.getStderr()));
            }
            return readProduced(Tool.IMAGEMAGICK.key(), output);
        });
    }

    String executable(Tool tool) {
        return binaries.getOrDefault(tool.key(), tool.defaultCommand());
    }

    private String stdoutOf(Tool tool, byte[] pdf) {
        return inScratch(tool.key(), dir -> {
            Path input = write(dir, "input.pdf", pdf);
            CommandLine cmd = new CommandLine(executable(tool));
            cmd.addArgument(input.toString(), false);
            ToolOutput output = execute(cmd, dir, timeoutMs);
            requireSuccess(tool.key(), output);
            return output.stdoutText();
        });
    }

    private ToolOutput execute(CommandLine cmdLine, Path workDir, long timeout) {
        DefaultExecutor executor = new DefaultExecutor();
        BoundedOutputStream outputStream = new BoundedOutputStream(maxOutputBytes);
        BoundedOutputStream errorStream = new BoundedOutputStream(maxOutputBytes);
        executor.setStreamHandler(new PumpStreamHandler(outputStream, errorStream));
        ExecuteWatchdog watchdog = new ExecuteWatchdog(timeout);
        executor.setWatchdog(watchdog);
        if (workDir != null) {
            executor.setWorkingDirectory(workDir.toFile());
        }
        // exit codes are interpreted by the callers
        executor.setExitValues(null);

        try {
            logger.debug("Executing: {}", cmdLine);
            int exitValue = executor.execute(cmdLine);
            if (watchdog.killedProcess()) {
                throw new ToolExecutionException(cmdLine.getExecutable() + " timed out after " + timeout + " ms");
            }
            return new ToolOutput(exitValue, outputStream.toByteArray(), errorStream.asText(),
                    outputStream.isTruncated() || errorStream.isTruncated());
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to run " + cmdLine.getExecutable() + ": " + e.getMessage(), e);
        }
    }

    private static void requireSuccess(String tool, ToolOutput output) {
        if (!output.succeeded()) {
            throw new ToolExecutionException(tool + " exited with code " + output.getExitCode()
                    + (output.getStderr().isBlank() ? "" : ": " + abbreviate(output.getStderr())));
        }
    }

    private static byte[] readProduced(String tool, Path file) throws IOException {
        if (!Files.isRegularFile(file) || Files.size(file) == 0) {
            throw new ToolExecutionException(tool + " produced no output");
        }
        return Files.readAllBytes(file);
    }

    private static Path write(Path dir, String name, byte[] content) throws IOException {
        return Files.write(dir.resolve(name), content);
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }

    private <T> T inScratch(String prefix, ScratchTask<T> task) {
        Path dir;
        try {
            dir = Files.createTempDirectory("prepress-" + prefix + "-");
        } catch (IOException e) {
            throw new ToolExecutionException("Cannot create scratch directory", e);
        }
        try {
            return task.run(dir);
        } catch (IOException e) {
            throw new ToolExecutionException(prefix + " scratch I/O failed: " + e.getMessage(), e);
        } finally {
            if (!FileSystemUtils.deleteRecursively(dir.toFile())) {
                logger.warn("Could not remove scratch directory {}", dir);
            }
        }
    }

    @FunctionalInterface
    private interface ScratchTask<T> {
        T run(Path dir) throws IOException;
    }
}
