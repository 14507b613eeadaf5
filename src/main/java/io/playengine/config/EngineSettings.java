package io.playengine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.playengine.util.Jsons;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Tunables read from {@code playengine-settings.json} in the data root. Absent keys fall back to
 * {@link #defaults()}; out of range values are clamped.
 */
public record EngineSettings(
        boolean sandboxEnabled,
        String sandboxCommand,
        List<String> sandboxHidePaths,
        List<String> sandboxShowPaths,
        boolean sandboxUnshareNetwork,
        List<String> playbookCommand,
        List<String> inventoryImportCommand,
        long cancelPollIntervalMs,
        long defaultJobTimeoutSeconds,
        int terminalColumns,
        int terminalRows,
        int workerThreads
) {
    public static final long DEFAULT_CANCEL_POLL_INTERVAL_MS = 500L;
    public static final int DEFAULT_WORKER_THREADS = 4;

    public EngineSettings {
        sandboxHidePaths = sandboxHidePaths == null ? List.of() : List.copyOf(sandboxHidePaths);
        sandboxShowPaths = sandboxShowPaths == null ? List.of() : List.copyOf(sandboxShowPaths);
        playbookCommand = playbookCommand == null ? List.of() : List.copyOf(playbookCommand);
        inventoryImportCommand = inventoryImportCommand == null ? List.of() : List.copyOf(inventoryImportCommand);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                true,
                "bwrap",
                List.of("/var/log", "/tmp"),
                List.of(),
                false,
                List.of("ansible-playbook"),
                List.of("playengine-inventory-import"),
                DEFAULT_CANCEL_POLL_INTERVAL_MS,
                0L,
                200,
                50,
                DEFAULT_WORKER_THREADS
        );
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load engine settings: " + file, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new EngineSettings(
                file.sandboxEnabled() == null ? defaults.sandboxEnabled() : file.sandboxEnabled(),
                sanitizeString(file.sandboxCommand(), defaults.sandboxCommand()),
                file.sandboxHidePaths() == null ? defaults.sandboxHidePaths() : file.sandboxHidePaths(),
                file.sandboxShowPaths() == null ? defaults.sandboxShowPaths() : file.sandboxShowPaths(),
                file.sandboxUnshareNetwork() == null ? defaults.sandboxUnshareNetwork() : file.sandboxUnshareNetwork(),
                sanitizeCommand(file.playbookCommand(), defaults.playbookCommand()),
                sanitizeCommand(file.inventoryImportCommand(), defaults.inventoryImportCommand()),
                sanitizeLong(file.cancelPollIntervalMs(), defaults.cancelPollIntervalMs(), 10L),
                sanitizeLong(file.defaultJobTimeoutSeconds(), defaults.defaultJobTimeoutSeconds(), 0L),
                sanitizeInt(file.terminalColumns(), defaults.terminalColumns(), 20),
                sanitizeInt(file.terminalRows(), defaults.terminalRows(), 5),
                sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1)
        );
    }

    public EngineSettings withSandboxEnabled(boolean value) {
        return new EngineSettings(value, sandboxCommand, sandboxHidePaths, sandboxShowPaths, sandboxUnshareNetwork,
                playbookCommand, inventoryImportCommand, cancelPollIntervalMs, defaultJobTimeoutSeconds,
                terminalColumns, terminalRows, workerThreads);
    }

    private static String sanitizeString(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static List<String> sanitizeCommand(List<String> value, List<String> fallback) {
        if (value == null || value.isEmpty() || value.get(0) == null || value.get(0).isBlank()) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Boolean sandboxEnabled,
            String sandboxCommand,
            List<String> sandboxHidePaths,
            List<String> sandboxShowPaths,
            Boolean sandboxUnshareNetwork,
            List<String> playbookCommand,
            List<String> inventoryImportCommand,
            Long cancelPollIntervalMs,
            Long defaultJobTimeoutSeconds,
            Integer terminalColumns,
            Integer terminalRows,
            Integer workerThreads
    ) {
    }
}
