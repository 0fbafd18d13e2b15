package com.titan.prepress.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "prepress")
public class PrepressProperties {

    @Valid
    private Storage storage = new Storage();

    @Positive
    private int maxUploadSizeMb = 250;

    @Positive
    private int jobTtlHours = 12;

    /** DPI below which a missing_dpi finding is recorded. */
    @Positive
    private int requiredDpi = 300;

    @Valid
    private Tools tools = new Tools();

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Cleanup cleanup = new Cleanup();

    public long maxUploadSizeBytes() {
        return maxUploadSizeMb * 1024L * 1024L;
    }

    @Data
    public static class Storage {
        @NotBlank
        private String tempDir = Path.of(System.getProperty("java.io.tmpdir"), "prepress").toString();

        public Path tempRoot() {
            return Path.of(tempDir);
        }
    }

    @Data
    public static class Tools {
        @Positive
        private long timeoutMs = 180_000;
        @Positive
        private long probeTimeoutMs = 5_000;
        @Positive
        private int maxOutputBytes = 10 * 1024 * 1024;
        /** Executable overrides keyed by tool key, e.g. {@code ghostscript -> /opt/gs/bin/gs}. */
        private Map<String, String> binaries = new LinkedHashMap<>();
    }

    @Data
    public static class Worker {
        private boolean enabled = true;
        @Positive
        private long pollIntervalMs = 10_000;
        @Min(1)
        private int concurrency = 1;
    }

    @Data
    public static class Cleanup {
        private boolean enabled = true;
        @Positive
        private long intervalMs = 1_800_000;
        @Positive
        private int batchSize = 100;
        @Min(0)
        private long runningGraceMs = 3_600_000;
    }
}
