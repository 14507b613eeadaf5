package io.playengine.runtime;

import io.playengine.credential.InjectionContext;
import io.playengine.credential.MachineLogin;
import io.playengine.model.Job;
import io.playengine.model.JobType;
import io.playengine.process.PasswordPromptMap;
import io.playengine.util.Jsons;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Runs a playbook. */
public final class RunJob extends BaseRunTask<Job> {
    static final PasswordPromptMap PROMPTS = PasswordPromptMap.builder()
            .prompt("Enter passphrase for .*:\\s*?$", "ssh_key_unlock")
            .prompt("(?i)(sudo|su|pbrun|pfexec|doas|dzdo|become) password.*:\\s*?$", "become_password")
            .prompt("SSH password:\\s*?$", "ssh_password")
            .prompt("Password:\\s*?$", "ssh_password")
            .prompt("Vault password:\\s*?$", "vault_password")
            .build();

    public RunJob(RunDependencies deps) {
        super(deps);
    }

    @Override
    protected PreparedRun prepare(Job job, InjectionContext injection) throws IOException {
        MachineLogin login = deps.injector().injectMachine(job.credential(), job.launchPasswords(), injection);
        deps.injector().injectCloud(job.cloudCredential(), injection);
        deps.injector().injectNetwork(job.networkCredential(), injection);

        Map<String, String> passwords = injection.passwords();
        List<String> args = new ArrayList<>(deps.settings().playbookCommand());
        args.add("-i");
        args.add(job.inventory());
        if (job.jobType() == JobType.CHECK) {
            args.add("--check");
        }
        if (login.username() != null) {
            args.add("-u");
            args.add(login.username());
        }
        if (passwords.containsKey("ssh_password")) {
            args.add("--ask-pass");
        }
        if (job.becomeEnabled()) {
            args.add("--become");
        }
        if (job.diffMode()) {
            args.add("--diff");
        }
        if (login.becomeMethod() != null) {
            args.add("--become-method");
            args.add(login.becomeMethod());
        }
        if (login.becomeUsername() != null) {
            args.add("--become-user");
            args.add(login.becomeUsername());
        }
        if (passwords.containsKey("become_password")) {
            args.add("--ask-become-pass");
        }
        if (job.forks() > 0) {
            args.add("--forks=" + job.forks());
        }
        if (notBlank(job.limit())) {
            args.add("-l");
            args.add(job.limit());
        }
        if (job.verbosity() > 0) {
            args.add(verbosityFlag(job.verbosity()));
        }
        if (notBlank(job.jobTags())) {
            args.add("-t");
            args.add(job.jobTags());
        }
        if (notBlank(job.skipTags())) {
            args.add("--skip-tags=" + job.skipTags());
        }
        if (notBlank(job.startAtTask())) {
            args.add("--start-at-task=" + job.startAtTask());
        }
        if (passwords.containsKey("vault_password")) {
            args.add("--ask-vault-pass");
        }

        Map<String, Object> extraVars = new LinkedHashMap<>();
        extraVars.put("engine_job_id", job.id());
        extraVars.put("engine_job_type", job.jobType().name().toLowerCase(Locale.ROOT));
        extraVars.putAll(job.extraVars());
        args.add("-e");
        args.add(Jsons.toCompactJson(extraVars));
        args.addAll(injection.extraArgs());
        args.add(job.playbook());

        Map<String, String> env = new LinkedHashMap<>();
        env.put("ANSIBLE_HOST_KEY_CHECKING", "False");
        return new PreparedRun(args, env, job.projectPath(), PROMPTS, List.of());
    }

    @Override
    protected Map<String, String> reservedEnv(Job job) {
        return Map.of("JOB_ID", String.valueOf(job.id()));
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
