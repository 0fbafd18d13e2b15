package com.titan.prepress.toolchain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of which tools are usable for one pipeline run, plus best-effort version strings.
 */
public final class ToolchainStatus {

    private final Map<Tool, Boolean> availability;
    private final Map<Tool, String> versions;

    public ToolchainStatus(Map<Tool, Boolean> availability, Map<Tool, String> versions) {
        this.availability = new EnumMap<>(Tool.class);
        for (Tool tool : Tool.values()) {
            this.availability.put(tool, Boolean.TRUE.equals(availability.get(tool)));
        }
        this.versions = versions.isEmpty() ? new EnumMap<>(Tool.class) : new EnumMap<>(versions);
    }

    public static ToolchainStatus none() {
        return new ToolchainStatus(Map.of(), Map.of());
    }

    public boolean isAvailable(Tool tool) {
        return availability.get(tool);
    }

    public Optional<String> version(Tool tool) {
        return Optional.ofNullable(versions.get(tool));
    }

    /** Availability keyed by tool key, in declaration order. */
    public Map<String, Boolean> availabilityByKey() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        availability.forEach((tool, available) -> result.put(tool.key(), available));
        return Collections.unmodifiableMap(result);
    }

    public Map<String, String> versionsByKey() {
        Map<String, String> result = new LinkedHashMap<>();
        versions.forEach((tool, version) -> result.put(tool.key(), version));
        return Collections.unmodifiableMap(result);
    }
}
