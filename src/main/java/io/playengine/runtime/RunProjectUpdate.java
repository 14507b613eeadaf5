package io.playengine.runtime;

import io.playengine.credential.InjectionContext;
import io.playengine.credential.ScmLogin;
import io.playengine.lock.LockHandle;
import io.playengine.model.ProjectUpdate;
import io.playengine.model.ScmType;
import io.playengine.observability.AuditLogger;
import io.playengine.process.PasswordPromptMap;
import io.playengine.security.SecretRedactor;
import io.playengine.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Checks out or refreshes a project from source control. Updates of the same checkout are
 * serialized through the lock file next to it.
 */
public final class RunProjectUpdate extends BaseRunTask<ProjectUpdate> {
    static final String PLAYBOOK = "project_update.yml";
    static final String HOST_KEY = "scm_host_key";

    static final PasswordPromptMap PROMPTS = PasswordPromptMap.builder()
            .prompt("Username for.*:\\s*?$", "scm_username")
            .prompt("Password for.*:\\s*?$", "scm_password")
            .prompt("Password:\\s*?$", "scm_password")
            .prompt("\\S+?@\\S+?'s\\s+?password:\\s*?$", "scm_password")
            .prompt("Enter passphrase for .*:\\s*?$", "scm_key_unlock")
            .prompt("Are you sure you want to continue connecting \\(yes/no\\)\\?\\s*?$", HOST_KEY)
            .build();

    private final ConcurrentMap<Long, LockHandle> heldLocks = new ConcurrentHashMap<>();

    public RunProjectUpdate(RunDependencies deps) {
        super(deps);
    }

    @Override
    protected void preRunHook(ProjectUpdate update) throws Exception {
        LockHandle handle = deps.locks().acquire(update.lockFile());
        heldLocks.put(update.id(), handle);
        deps.audit().log(AuditLogger.AuditEvent.of("lock.acquire", update.kind(), update.id(),
                update.lockFile().toString(), "ok", Map.of()));
    }

    @Override
    protected void postRunHook(ProjectUpdate update) {
        LockHandle handle = heldLocks.remove(update.id());
        if (handle == null) {
            return;
        }
        deps.locks().release(handle);
        deps.audit().log(AuditLogger.AuditEvent.of("lock.release", update.kind(), update.id(),
                update.lockFile().toString(), "ok", Map.of()));
    }

    @Override
    protected PreparedRun prepare(ProjectUpdate update, InjectionContext injection) throws IOException {
        ScmLogin login = deps.injector().injectScm(update.credential(), injection);
        injection.putPassword(HOST_KEY, update.scmAcceptHostkey() ? "yes" : "no");

        Map<String, Object> extraVars = new LinkedHashMap<>();
        extraVars.put("scm_type", update.scmType().value());
        extraVars.put("scm_url", scmUrl(update, login));
        extraVars.put("scm_branch", update.scmBranch());
        extraVars.put("scm_clean", update.scmClean());
        extraVars.put("scm_delete_on_update", update.scmDeleteOnUpdate());
        extraVars.put("scm_accept_hostkey", update.scmAcceptHostkey());
        extraVars.put("project_path", update.projectPath().toString());
        if (update.scmType() == ScmType.SVN) {
            if (login.hasUsername()) {
                extraVars.put("scm_username", login.username());
            }
            if (login.hasPassword()) {
                extraVars.put("scm_password", login.password());
            }
        }
        extraVars.putAll(update.extraVars());

        List<String> args = new ArrayList<>(deps.settings().playbookCommand());
        args.add("-i");
        args.add("localhost,");
        if (update.verbosity() > 0) {
            args.add(verbosityFlag(update.verbosity()));
        }
        args.add("-e");
        args.add(Jsons.toCompactJson(extraVars));
        args.add(PLAYBOOK);

        Map<String, String> env = new LinkedHashMap<>();
        env.put("ANSIBLE_ASK_PASS", "False");
        env.put("ANSIBLE_BECOME_ASK_PASS", "False");
        env.put("DISPLAY", "");

        List<List<String>> replacements = new ArrayList<>();
        if (login.hasPassword()) {
            replacements.add(List.of("scm_password", SecretRedactor.HIDDEN));
        }
        if (injection.passwords().containsKey("scm_key_unlock")) {
            replacements.add(List.of("scm_key_unlock", SecretRedactor.HIDDEN));
        }
        return new PreparedRun(args, env, deps.config().playbooksRoot(), PROMPTS, replacements);
    }

    @Override
    protected Map<String, String> reservedEnv(ProjectUpdate update) {
        return Map.of("PROJECT_UPDATE_ID", String.valueOf(update.id()));
    }

    /** http(s) git and hg URLs carry the username so the password prompt names the right user. */
    static String scmUrl(ProjectUpdate update, ScmLogin login) {
        String url = update.scmUrl();
        if (update.scmType() == ScmType.SVN || !login.hasUsername()) {
            return url;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getRawUserInfo() != null || uri.getHost() == null) {
                return url;
            }
            return new URI(scheme, login.username(), uri.getHost(), uri.getPort(), uri.getPath(), uri.getQuery(),
                    uri.getFragment()).toString();
        } catch (URISyntaxException e) {
            return url;
        }
    }
}
