package io.playengine.cli;

import io.playengine.config.EngineConfig;
import io.playengine.model.JobStatus;
import io.playengine.storage.FileJobStore;
import io.playengine.storage.JobFields;
import io.playengine.storage.JobState;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlayEngineCommandTest {
    @Test
    void initCreatesLayoutAndKeyring() throws Exception {
        Path root = Files.createTempDirectory("playengine-cli-init-");
        int code = execute("--root", root.toString(), "init");

        EngineConfig config = new EngineConfig(root.toAbsolutePath().normalize());
        assertEquals(0, code);
        assertTrue(Files.isDirectory(config.jobsRoot()));
        assertTrue(Files.isDirectory(config.privateDataRoot()));
        assertTrue(Files.exists(config.credentialKeyFile()));
        assertEquals(0, execute("--root", root.toString(), "key-rotate"));
        assertEquals(0, execute("--root", root.toString(), "key-status"));
    }

    @Test
    void runHonoursCancelRequestedBeforeStart() throws Exception {
        Path root = Files.createTempDirectory("playengine-cli-run-");
        Path jobFile = root.resolve("job-41.json");
        Files.writeString(jobFile, """
                {"kind": "job", "id": 41, "playbook": "site.yml", "project_path": "demo"}
                """, StandardCharsets.UTF_8);

        assertEquals(0, execute("--root", root.toString(), "cancel", "--id", "41"));
        assertEquals(1, execute("--root", root.toString(), "status", "--id", "41"));
        int code = execute("--root", root.toString(), "run", "--file", jobFile.toString());

        assertEquals(2, code);
        FileJobStore store = new FileJobStore(new EngineConfig(root.toAbsolutePath().normalize()).jobsRoot());
        JobState state = store.load(41L);
        assertEquals(JobStatus.CANCELED, state.status());
        assertTrue(state.cancelFlag());
        assertTrue(String.valueOf(state.field(JobFields.RESULT_TRACEBACK)).contains("canceled before"));
        assertEquals(0, execute("--root", root.toString(), "status", "--id", "41"));
    }

    @Test
    void exitCodeFollowsTerminalStatus() {
        assertEquals(0, PlayEngineCommand.exitCode(JobStatus.SUCCESSFUL));
        assertEquals(2, PlayEngineCommand.exitCode(JobStatus.CANCELED));
        assertEquals(1, PlayEngineCommand.exitCode(JobStatus.FAILED));
        assertEquals(1, PlayEngineCommand.exitCode(JobStatus.ERROR));
    }

    private static int execute(String... args) {
        return new CommandLine(new PlayEngineCommand()).execute(args);
    }
}
