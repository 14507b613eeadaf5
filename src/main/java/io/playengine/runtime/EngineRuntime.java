package io.playengine.runtime;

import io.playengine.config.EngineConfig;
import io.playengine.config.EngineSettings;
import io.playengine.credential.CredentialInjector;
import io.playengine.lock.ResourceLockManager;
import io.playengine.model.InventoryUpdate;
import io.playengine.model.Job;
import io.playengine.model.ProjectUpdate;
import io.playengine.model.UnifiedJob;
import io.playengine.observability.AuditLogger;
import io.playengine.privatedata.PrivateDataManager;
import io.playengine.process.InteractiveProcessRunner;
import io.playengine.process.PtyTerminalLauncher;
import io.playengine.security.SecretCipher;
import io.playengine.storage.FileJobStore;
import io.playengine.storage.JobStore;
import io.playengine.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One engine instance: the directories under a data root, the collaborators every run shares and
 * a fixed pool of workers. Each worker runs one job at a time.
 */
public final class EngineRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(EngineRuntime.class);

    private final RunDependencies deps;
    private final SecretCipher cipher;
    private final RunJob runJob;
    private final RunProjectUpdate runProjectUpdate;
    private final RunInventoryUpdate runInventoryUpdate;
    private final ExecutorService workers;

    public EngineRuntime(RunDependencies deps, SecretCipher cipher) {
        this.deps = deps;
        this.cipher = cipher;
        this.runJob = new RunJob(deps);
        this.runProjectUpdate = new RunProjectUpdate(deps);
        this.runInventoryUpdate = new RunInventoryUpdate(deps);
        this.workers = Executors.newFixedThreadPool(Math.max(1, deps.settings().workerThreads()), workerThreads());
    }

    public static EngineRuntime init(EngineConfig config) {
        createDirectories(config);
        EngineSettings settings = EngineSettings.load(config.settingsFile());
        SecretCipher cipher = new SecretCipher(config.credentialKeyFile());
        RunDependencies deps = new RunDependencies(
                config,
                settings,
                new FileJobStore(config.jobsRoot()),
                new CredentialInjector(cipher, new TemplateRenderer()),
                new PrivateDataManager(config.privateDataRoot()),
                new InteractiveProcessRunner(
                        new PtyTerminalLauncher(settings.terminalColumns(), settings.terminalRows()),
                        settings.cancelPollIntervalMs()
                ),
                new ResourceLockManager(),
                new AuditLogger(config.auditRoot().resolve("audit.jsonl"))
        );
        LOG.info("Engine initialized at {} (sandbox={}, workers={})",
                config.rootDir(), settings.sandboxEnabled(), settings.workerThreads());
        return new EngineRuntime(deps, cipher);
    }

    /** Runs {@code job} on the calling thread. */
    public RunOutcome execute(UnifiedJob job) {
        deps.store().register(job.id());
        if (job instanceof Job playbookJob) {
            return runJob.run(playbookJob);
        }
        if (job instanceof ProjectUpdate update) {
            return runProjectUpdate.run(update);
        }
        if (job instanceof InventoryUpdate update) {
            return runInventoryUpdate.run(update);
        }
        throw new IllegalArgumentException("Unsupported job kind: " + job.kind());
    }

    public Future<RunOutcome> submit(UnifiedJob job) {
        return workers.submit(() -> execute(job));
    }

    public RunDependencies dependencies() {
        return deps;
    }

    public JobStore store() {
        return deps.store();
    }

    public SecretCipher cipher() {
        return cipher;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Workers still busy after 30s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void createDirectories(EngineConfig config) {
        List<Path> dirs = List.of(
                config.rootDir(),
                config.privateDataRoot(),
                config.jobOutputRoot(),
                config.projectsRoot(),
                config.jobsRoot(),
                config.securityRoot(),
                config.auditRoot(),
                config.playbooksRoot(),
                config.inventoryPluginsRoot()
        );
        for (Path dir : dirs) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new RuntimeException("Failed to create engine directory: " + dir, e);
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "engine-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
