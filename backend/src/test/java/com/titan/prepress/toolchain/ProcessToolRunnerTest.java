package com.titan.prepress.toolchain;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs stand-in binaries from a POSIX userland in place of the real tools.
 */
class ProcessToolRunnerTest {

    private static final long TIMEOUT_MS = 10_000;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void requirePosixShell() {
        assumeTrue(new File("/bin/sh").canExecute(), "needs /bin/sh");
        assumeTrue(!System.getProperty("os.name").toLowerCase().contains("win"), "needs a POSIX userland");
    }

    private static ProcessToolRunner runner(Map<String, String> binaries) {
        return new ProcessToolRunner(TIMEOUT_MS, 1024 * 1024, binaries);
    }

    @Test
    void versionProbePassesTheToolsFlag() {
        ToolOutput output = runner(Map.of("qpdf", "echo")).version(Tool.QPDF, TIMEOUT_MS);

        assertTrue(output.succeeded());
        assertEquals("--version", output.stdoutText().trim());
    }

    @Test
    void binaryOverridesFallBackToDefaultCommands() {
        ProcessToolRunner runner = runner(Map.of("ghostscript", "/opt/gs/bin/gs"));

        assertEquals("/opt/gs/bin/gs", runner.executable(Tool.GHOSTSCRIPT));
        assertEquals("pdftocairo", runner.executable(Tool.PDFTOCAIRO));
    }

    @Test
    void inputBytesReachTheToolThroughAScratchFile() {
        byte[] pdf = "%PDF-1.4\n% scratch\n".getBytes(StandardCharsets.US_ASCII);

        String stdout = runner(Map.of("pdfinfo", "cat")).pdfInfo(pdf);

        assertEquals(new String(pdf, StandardCharsets.US_ASCII), stdout);
    }

    @Test
    void missingBinaryIsAToolFailure() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> runner(Map.of("pdffonts", "/nonexistent/pdffonts")).pdfFonts(new byte[]{1}));
        assertTrue(e.getMessage().startsWith("Failed to run"));
    }

    @Test
    void nonZeroExitThrowsExceptForStructureCheck() {
        ProcessToolRunner runner = runner(Map.of("pdffonts", "false", "qpdf", "false"));

        ToolExecutionException e = assertThrows(ToolExecutionException.class, () -> runner.pdfFonts(new byte[]{1}));
        assertTrue(e.getMessage().contains("exited with code 1"));

        ToolOutput structure = runner.checkStructure(new byte[]{1});
        assertEquals(1, structure.getExitCode());
    }

    @Test
    void outputIsCappedAndFlagged() throws Exception {
        byte[] large = new byte[4096];
        Arrays.fill(large, (byte) 'x');
        Path script = tempDir.resolve("check.sh");
        // qpdf is called as "qpdf --check <file>"
        Files.writeString(script, "#!/bin/sh\nexec cat \"$2\"\n");
        assumeTrue(script.toFile().setExecutable(true));

        ToolOutput output = new ProcessToolRunner(TIMEOUT_MS, 100, Map.of("qpdf", script.toString())).checkStructure(large);

        assertEquals(100, output.getStdout().length);
        assertTrue(output.isTruncated());
    }

    @Test
    void slowToolIsKilledAtTheTimeout() throws Exception {
        Path script = tempDir.resolve("slow.sh");
        Files.writeString(script, "#!/bin/sh\nexec sleep 5\n");
        assumeTrue(script.toFile().setExecutable(true));

        long started = System.nanoTime();
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> runner(Map.of("pdftocairo", script.toString())).version(Tool.PDFTOCAIRO, 300));

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(System.nanoTime() - started < 4_000_000_000L);
    }

    @Test
    void toolThatWritesNothingIsAFailure() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> runner(Map.of("ghostscript", "true")).repairPdf(new byte[]{1}));
        assertEquals("ghostscript produced no output", e.getMessage());
    }
}
