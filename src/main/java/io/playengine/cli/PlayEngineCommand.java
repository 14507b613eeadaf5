package io.playengine.cli;

import io.playengine.config.EngineConfig;
import io.playengine.model.JobStatus;
import io.playengine.model.UnifiedJob;
import io.playengine.runtime.EngineRuntime;
import io.playengine.runtime.RunOutcome;
import io.playengine.security.SecretCipher;
import io.playengine.storage.FileJobStore;
import io.playengine.storage.JobState;
import io.playengine.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "playengine",
        mixinStandardHelpOptions = true,
        description = "Runs playbooks, project updates and inventory updates in a private, sandboxed terminal",
        subcommands = {
                PlayEngineCommand.InitCommand.class,
                PlayEngineCommand.RunCommand.class,
                PlayEngineCommand.CancelCommand.class,
                PlayEngineCommand.StatusCommand.class,
                PlayEngineCommand.EncryptCommand.class,
                PlayEngineCommand.KeyStatusCommand.class,
                PlayEngineCommand.KeyRotateCommand.class
        }
)
public final class PlayEngineCommand implements Runnable {
    @Option(names = {"--root"}, description = "Engine data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | cancel | status | encrypt | key-status | key-rotate");
    }

    EngineConfig config() {
        return EngineConfig.fromRoot(root);
    }

    EngineRuntime runtime() {
        return EngineRuntime.init(config());
    }

    static int exitCode(JobStatus status) {
        return switch (status) {
            case SUCCESSFUL -> 0;
            case CANCELED -> 2;
            default -> 1;
        };
    }

    @Command(name = "init", description = "Create the data directories and the credential keyring")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PlayEngineCommand parent;

        @Override
        public Integer call() {
            try (EngineRuntime runtime = parent.runtime()) {
                System.out.println("Initialized PlayEngine at: " + runtime.dependencies().config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Run a job definition file and print its outcome")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        PlayEngineCommand parent;

        @Option(names = {"--file"}, required = true, description = "Job definition JSON file")
        Path file;

        @Override
        public Integer call() {
            try (EngineRuntime runtime = parent.runtime()) {
                UnifiedJob job = new JobFileLoader(runtime.dependencies().config().projectsRoot()).load(file);
                RunOutcome outcome = runtime.execute(job);
                System.out.println(Jsons.toJson(outcome));
                return exitCode(outcome.status());
            }
        }
    }

    @Command(name = "cancel", description = "Request cancellation of a job")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        PlayEngineCommand parent;

        @Option(names = {"--id"}, required = true, description = "Job id")
        long id;

        @Override
        public Integer call() {
            FileJobStore store = new FileJobStore(parent.config().jobsRoot());
            store.requestCancel(id);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id);
            out.put("cancel_requested", true);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "status", description = "Show the stored state of a job")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        PlayEngineCommand parent;

        @Option(names = {"--id"}, required = true, description = "Job id")
        long id;

        @Override
        public Integer call() {
            FileJobStore store = new FileJobStore(parent.config().jobsRoot());
            if (!store.exists(id)) {
                System.out.println("{\"error\":\"job not found\"}");
                return 1;
            }
            JobState state = store.load(id);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", state.id());
            out.put("status", state.status().value());
            out.put("cancel_flag", state.cancelFlag());
            out.put("fields", state.fields());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "encrypt", description = "Encrypt a credential input for a job definition file")
    static final class EncryptCommand implements Callable<Integer> {
        @ParentCommand
        PlayEngineCommand parent;

        @Option(names = {"--value"}, required = true, description = "Plain value to encrypt")
        String value;

        @Override
        public Integer call() {
            SecretCipher cipher = new SecretCipher(parent.config().credentialKeyFile());
            System.out.println(cipher.encrypt(value));
            return 0;
        }
    }

    @Command(name = "key-status", description = "Show the credential keyring status")
    static final class KeyStatusCommand implements Callable<Integer> {
        @ParentCommand
        PlayEngineCommand parent;

        @Override
        public Integer call() {
            SecretCipher cipher = new SecretCipher(parent.config().credentialKeyFile());
            System.out.println(Jsons.toJson(cipher.status()));
            return 0;
        }
    }

    @Command(name = "key-rotate", description = "Add a credential key and make it active")
    static final class KeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        PlayEngineCommand parent;

        @Override
        public Integer call() {
            SecretCipher cipher = new SecretCipher(parent.config().credentialKeyFile());
            System.out.println(Jsons.toJson(cipher.rotate()));
            return 0;
        }
    }
}
