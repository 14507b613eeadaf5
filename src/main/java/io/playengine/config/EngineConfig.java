package io.playengine.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class EngineConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "playengine-settings.json";

    private final Path rootDir;

    public EngineConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static EngineConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new EngineConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path privateDataRoot() {
        return rootDir.resolve("private");
    }

    public Path jobOutputRoot() {
        return rootDir.resolve("job_output");
    }

    public Path projectsRoot() {
        return rootDir.resolve("projects");
    }

    public Path jobsRoot() {
        return rootDir.resolve("jobs");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path credentialKeyFile() {
        return securityRoot().resolve("credential-keys.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path playbooksRoot() {
        return rootDir.resolve("playbooks");
    }

    public Path inventoryPluginsRoot() {
        return rootDir.resolve("inventory_plugins");
    }
}
