package com.titan.prepress.toolchain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes every {@link Tool} concurrently. A probe that fails, exits non-zero or exceeds the
 * probe timeout marks the tool unavailable; detection itself never fails.
 */
public class ToolDetector {

    private static final Logger logger = LoggerFactory.getLogger(ToolDetector.class);

    private final ToolRunner toolRunner;
    private final long probeTimeoutMs;
    private final Executor executor;

    public ToolDetector(ToolRunner toolRunner, long probeTimeoutMs, Executor executor) {
        this.toolRunner = toolRunner;
        this.probeTimeoutMs = probeTimeoutMs;
        this.executor = executor;
    }

    public ToolchainStatus detect() {
        Map<Tool, CompletableFuture<Probe>> probes = new EnumMap<>(Tool.class);
        for (Tool tool : Tool.values()) {
            probes.put(tool, CompletableFuture.supplyAsync(() -> probe(tool), executor));
        }

        Map<Tool, Boolean> availability = new EnumMap<>(Tool.class);
        Map<Tool, String> versions = new EnumMap<>(Tool.class);
        probes.forEach((tool, future) -> {
            Probe probe = await(tool, future);
            availability.put(tool, probe.available);
            if (probe.version != null) {
                versions.put(tool, probe.version);
            }
        });

        ToolchainStatus status = new ToolchainStatus(availability, versions);
        logAvailability(status);
        return status;
    }

    private Probe probe(Tool tool) {
        try {
            ToolOutput output = toolRunner.version(tool, probeTimeoutMs);
            String version = firstLine(output.stdoutText()).or(() -> firstLine(output.getStderr())).orElse(null);
            return new Probe(true, version);
        } catch (RuntimeException e) {
            logger.debug("Probe for {} failed: {}", tool.key(), e.getMessage());
            return Probe.UNAVAILABLE;
        }
    }

    private Probe await(Tool tool, CompletableFuture<Probe> future) {
        try {
            // the runner enforces the probe timeout itself; this only bounds a stuck executor
            return future.get(probeTimeoutMs + 1_000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Probe.UNAVAILABLE;
        } catch (ExecutionException | TimeoutException e) {
            logger.debug("Probe for {} did not complete: {}", tool.key(), e.toString());
            future.cancel(true);
            return Probe.UNAVAILABLE;
        }
    }

    static Optional<String> firstLine(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return text.lines().map(String::trim).filter(line -> !line.isEmpty()).findFirst();
    }

    private static void logAvailability(ToolchainStatus status) {
        StringBuilder table = new StringBuilder("Tool availability:");
        for (Tool tool : Tool.values()) {
            table.append(System.lineSeparator()).append("  ").append(tool.key()).append(": ");
            if (status.isAvailable(tool)) {
                table.append("available (").append(status.version(tool).orElse("version unknown")).append(')');
            } else {
                table.append("not available");
            }
        }
        logger.info(table.toString());
    }

    private static final class Probe {
        static final Probe UNAVAILABLE = new Probe(false, null);

        final boolean available;
        final String version;

        Probe(boolean available, String version) {
            this.available = available;
            this.version = version;
        }
    }
}
