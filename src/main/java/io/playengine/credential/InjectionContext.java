package io.playengine.credential;

import io.playengine.privatedata.PrivateDataDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-run collector the injector fills in: environment, extra command line arguments,
 * prompt answers and every plaintext value that must later be redacted.
 */
public final class InjectionContext {
    private final PrivateDataDir privateData;
    private final Map<String, String> env = new LinkedHashMap<>();
    private final List<String> extraArgs = new ArrayList<>();
    private final Map<String, String> passwords = new LinkedHashMap<>();
    private final Set<String> secrets = new LinkedHashSet<>();
    private Path sshKeyFile;

    public InjectionContext(PrivateDataDir privateData) {
        this.privateData = privateData;
    }

    public PrivateDataDir privateData() {
        return privateData;
    }

    public void putEnv(String key, String value) {
        env.put(key, value == null ? "" : value);
    }

    public void putPassword(String key, String value) {
        if (value != null && !value.isEmpty()) {
            passwords.put(key, value);
        }
    }

    public void addExtraArgs(String... args) {
        Collections.addAll(extraArgs, args);
    }

    public void trackSecret(String value) {
        if (value != null && !value.isBlank()) {
            secrets.add(value);
        }
    }

    public void sshKeyFile(Path path) {
        this.sshKeyFile = path;
    }

    public Path sshKeyFile() {
        return sshKeyFile;
    }

    public Map<String, String> env() {
        return env;
    }

    public List<String> extraArgs() {
        return Collections.unmodifiableList(extraArgs);
    }

    public Map<String, String> passwords() {
        return Collections.unmodifiableMap(passwords);
    }

    public Set<String> secrets() {
        return Collections.unmodifiableSet(secrets);
    }
}
