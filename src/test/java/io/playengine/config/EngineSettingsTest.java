package io.playengine.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class EngineSettingsTest {

    @Test
    void missingFileGivesDefaults() throws Exception {
        Path root = Files.createTempDirectory("playengine-test-settings-missing-");
        try {
            EngineConfig config = new EngineConfig(root);
            EngineSettings settings = EngineSettings.load(config.settingsFile());
            Assertions.assertEquals(EngineSettings.defaults(), settings);
            Assertions.assertTrue(settings.sandboxEnabled());
            Assertions.assertEquals(List.of("ansible-playbook"), settings.playbookCommand());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partialFileIsMergedAndClamped() throws Exception {
        Path root = Files.createTempDirectory("playengine-test-settings-partial-");
        try {
            Path file = root.resolve(EngineConfig.SETTINGS_FILE);
            Files.writeString(file, """
                    {
                      "sandboxEnabled": false,
                      "sandboxCommand": "  ",
                      "playbookCommand": ["/opt/venv/bin/ansible-playbook"],
                      "inventoryImportCommand": [],
                      "cancelPollIntervalMs": 1,
                      "workerThreads": 0,
                      "unknownKey": true
                    }
                    """, StandardCharsets.UTF_8);

            EngineSettings settings = EngineSettings.load(file);

            Assertions.assertFalse(settings.sandboxEnabled());
            Assertions.assertEquals("bwrap", settings.sandboxCommand());
            Assertions.assertEquals(List.of("/opt/venv/bin/ansible-playbook"), settings.playbookCommand());
            Assertions.assertEquals(List.of("playengine-inventory-import"), settings.inventoryImportCommand());
            Assertions.assertEquals(10L, settings.cancelPollIntervalMs());
            Assertions.assertEquals(1, settings.workerThreads());
            Assertions.assertEquals(List.of("/var/log", "/tmp"), settings.sandboxHidePaths());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedFileFailsWithPath() throws Exception {
        Path root = Files.createTempDirectory("playengine-test-settings-bad-");
        try {
            Path file = root.resolve(EngineConfig.SETTINGS_FILE);
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);

            RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> EngineSettings.load(file));
            Assertions.assertTrue(error.getMessage().contains(file.toString()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void configLaysOutDirectoriesUnderRoot() {
        EngineConfig config = EngineConfig.fromRoot("build/../data");
        Assertions.assertTrue(config.rootDir().isAbsolute());
        Assertions.assertEquals("data", config.rootDir().getFileName().toString());
        Assertions.assertEquals(config.rootDir().resolve("security/credential-keys.json"), config.credentialKeyFile());
        Assertions.assertEquals(config.rootDir().resolve("jobs"), config.jobsRoot());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
