package io.playengine.runtime;

import io.playengine.credential.InjectionContext;
import io.playengine.model.JobStatus;
import io.playengine.model.UnifiedJob;
import io.playengine.observability.AuditLogger;
import io.playengine.privatedata.PrivateDataDir;
import io.playengine.privatedata.SshAgentCommand;
import io.playengine.process.ProcessOutcome;
import io.playengine.process.ProcessRequest;
import io.playengine.process.SandboxPolicy;
import io.playengine.process.SandboxWrapper;
import io.playengine.security.RedactingWriter;
import io.playengine.security.SecretRedactor;
import io.playengine.storage.JobFields;
import io.playengine.storage.JobState;
import io.playengine.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle shared by every kind of run: mark running, honour an early cancel, prepare a private
 * data dir and credentials, build the confined command line, run it, and persist a terminal status.
 * <p>
 * {@link #run} never throws. Whatever goes wrong after the job is marked running ends in exactly
 * one terminal status, the private data dir is removed and {@link #postRunHook} is called.
 */
public abstract class BaseRunTask<T extends UnifiedJob> {
    private static final Logger LOG = LoggerFactory.getLogger(BaseRunTask.class);
    static final String CANCELED_BEFORE_START = "Run was canceled before the process was started";

    protected final RunDependencies deps;

    protected BaseRunTask(RunDependencies deps) {
        this.deps = deps;
    }

    public final RunOutcome run(T job) {
        Path stdoutFile = deps.config().jobOutputRoot().resolve(job.kind() + "_" + job.id() + ".out");
        JobState started;
        try {
            Map<String, Object> running = new LinkedHashMap<>();
            running.put(JobFields.STATUS, JobStatus.RUNNING.value());
            running.put(JobFields.CELERY_TASK_ID, "");
            started = deps.store().update(job.id(), running);
        } catch (RuntimeException e) {
            LOG.error("Could not mark {} {} running: {}", job.kind(), job.id(), e.getMessage());
            return new RunOutcome(job.id(), JobStatus.ERROR, -1, stackTrace(e), null, null);
        }

        if (started.cancelFlag()) {
            LOG.info("{} {} was canceled before start", job.kind(), job.id());
            Map<String, Object> canceled = new LinkedHashMap<>();
            canceled.put(JobFields.OUTPUT_REPLACEMENTS, List.of());
            canceled.put(JobFields.RESULT_TRACEBACK, CANCELED_BEFORE_START);
            canceled.put(JobFields.STATUS, JobStatus.CANCELED.value());
            RunOutcome outcome = new RunOutcome(job.id(), JobStatus.CANCELED, -1, CANCELED_BEFORE_START, null, null);
            persistFinal(job, canceled, SecretRedactor.none(), outcome);
            return outcome;
        }

        JobStatus status = JobStatus.FAILED;
        int exitCode = -1;
        String traceback = "";
        String explanation = null;
        List<List<String>> outputReplacements = List.of();
        SecretRedactor redactor = SecretRedactor.none();
        PrivateDataDir privateData = null;
        InjectionContext injection = null;
        Writer stdout = null;
        try {
            preRunHook(job);
            privateData = deps.privateData().open();
            injection = new InjectionContext(privateData);
            PreparedRun prepared = prepare(job, injection);
            outputReplacements = prepared.outputReplacements();

            Map<String, String> env = buildEnv(job, injection, prepared);
            List<String> args = confine(prepared.args(), prepared.cwd(), privateData);
            if (injection.sshKeyFile() != null) {
                args = SshAgentCommand.wrap(args, injection.sshKeyFile(), privateData.resolve(SshAgentCommand.AUTH_SOCK));
            }

            redactor = redactorFor(injection);

            Map<String, Object> record = new LinkedHashMap<>();
            record.put(JobFields.JOB_ARGS, Jsons.toCompactJson(redactor.redact(args)));
            record.put(JobFields.JOB_CWD, prepared.cwd().toString());
            record.put(JobFields.JOB_ENV, redactor.safeEnv(env));
            record.put(JobFields.RESULT_STDOUT_FILE, stdoutFile.toString());
            updateModel(job.id(), record, redactor);
            deps.audit().log(AuditLogger.AuditEvent.of("run.start", job.kind(), job.id(),
                    prepared.cwd().toString(), "ok", Map.of("args", args)), redactor);

            Files.createDirectories(stdoutFile.getParent());
            stdout = new RedactingWriter(Files.newBufferedWriter(stdoutFile, StandardCharsets.UTF_8), redactor);
            long timeout = job.timeoutSeconds() > 0 ? job.timeoutSeconds() : deps.settings().defaultJobTimeoutSeconds();
            ProcessOutcome outcome = deps.runner().run(new ProcessRequest(
                    job,
                    args,
                    prepared.cwd(),
                    env,
                    prepared.prompts(),
                    injection.passwords(),
                    stdout,
                    () -> deps.store().load(job.id()).cancelFlag(),
                    timeout
            ));
            status = outcome.status();
            exitCode = outcome.exitCode();
            explanation = outcome.explanation();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = JobStatus.FAILED;
            traceback = redactor.redact(stackTrace(e));
        } catch (Exception e) {
            if (injection != null) {
                redactor = redactorFor(injection);
            }
            LOG.warn("{} {} failed: {}", job.kind(), job.id(), redactor.redact(String.valueOf(e.getMessage())));
            status = JobStatus.FAILED;
            traceback = redactor.redact(stackTrace(e));
        } finally {
            closeQuietly(stdout, job);
            if (privateData != null) {
                privateData.close();
            }
            try {
                postRunHook(job);
            } catch (RuntimeException e) {
                LOG.error("Post-run hook failed for {} {}: {}", job.kind(), job.id(), e.getMessage());
            }
        }

        Map<String, Object> finish = new LinkedHashMap<>();
        finish.put(JobFields.STATUS, status.value());
        finish.put(JobFields.RESULT_TRACEBACK, traceback);
        finish.put(JobFields.OUTPUT_REPLACEMENTS, outputReplacements);
        if (explanation != null) {
            finish.put(JobFields.JOB_EXPLANATION, explanation);
        }
        RunOutcome outcome = new RunOutcome(job.id(), status, exitCode, traceback, explanation, stdoutFile);
        persistFinal(job, finish, redactor, outcome);
        return outcome;
    }

    /** Injects credentials and builds the task-specific command line, environment and prompts. */
    protected abstract PreparedRun prepare(T job, InjectionContext injection) throws IOException;

    /** Engine-owned variables. They override anything a credential or task put in the environment. */
    protected abstract Map<String, String> reservedEnv(T job);

    protected void preRunHook(T job) throws Exception {
    }

    protected void postRunHook(T job) {
    }

    protected void finalRunHook(T job, RunOutcome outcome) {
    }

    protected Map<String, String> baseEnv() {
        Map<String, String> env = new LinkedHashMap<>(System.getenv());
        env.put("PYTHONUNBUFFERED", "1");
        env.put("ANSIBLE_FORCE_COLOR", "True");
        env.put("ANSIBLE_RETRY_FILES_ENABLED", "False");
        return env;
    }

    private static SecretRedactor redactorFor(InjectionContext injection) {
        return SecretRedactor.of(injection.secrets());
    }

    static String verbosityFlag(int verbosity) {
        return "-" + "v".repeat(Math.min(5, Math.max(1, verbosity)));
    }

    private Map<String, String> buildEnv(T job, InjectionContext injection, PreparedRun prepared) {
        Map<String, String> env = baseEnv();
        env.putAll(injection.env());
        env.putAll(prepared.env());
        env.putAll(reservedEnv(job));
        return env;
    }

    private List<String> confine(List<String> args, Path cwd, PrivateDataDir privateData) {
        if (!deps.settings().sandboxEnabled()) {
            return args;
        }
        List<Path> show = new ArrayList<>();
        show.add(cwd);
        show.add(privateData.path());
        for (String extra : deps.settings().sandboxShowPaths()) {
            show.add(Path.of(extra));
        }
        List<Path> hide = new ArrayList<>();
        hide.add(deps.config().rootDir());
        for (String hidden : deps.settings().sandboxHidePaths()) {
            hide.add(Path.of(hidden));
        }
        SandboxPolicy policy = new SandboxPolicy(deps.settings().sandboxCommand(), cwd, show, hide,
                deps.settings().sandboxUnshareNetwork());
        return SandboxWrapper.wrap(args, policy);
    }

    private void updateModel(long id, Map<String, Object> fields, SecretRedactor redactor) {
        deps.store().update(id, redactor.redact(fields));
    }

    private void persistFinal(T job, Map<String, Object> fields, SecretRedactor redactor, RunOutcome outcome) {
        try {
            updateModel(job.id(), fields, redactor);
            deps.audit().log(AuditLogger.AuditEvent.of("run.finish", job.kind(), job.id(), null,
                    outcome.status().value(), Map.of("exit_code", outcome.exitCode())), redactor);
        } catch (RuntimeException e) {
            LOG.error("Could not persist final status of {} {}: {}", job.kind(), job.id(), e.getMessage());
        }
        try {
            finalRunHook(job, outcome);
        } catch (RuntimeException e) {
            LOG.error("Final-run hook failed for {} {}: {}", job.kind(), job.id(), e.getMessage());
        }
        LOG.info("{} {} finished: {} (rc={})", job.kind(), job.id(), outcome.status().value(), outcome.exitCode());
    }

    private static void closeQuietly(Writer writer, UnifiedJob job) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            LOG.warn("Failed to close output of {} {}: {}", job.kind(), job.id(), e.getMessage());
        }
    }

    static String stackTrace(Throwable e) {
        StringWriter out = new StringWriter();
        e.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
