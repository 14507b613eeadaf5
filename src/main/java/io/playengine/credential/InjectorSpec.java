package io.playengine.credential;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative injector of a user-defined credential type. {@code fileTemplate} renders into a generated
 * file whose path the other templates see as {@code tower.filename}.
 */
public record InjectorSpec(Map<String, String> env, String fileTemplate, Map<String, String> extraVars) {
    public InjectorSpec {
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        extraVars = extraVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraVars));
    }

    public static InjectorSpec empty() {
        return new InjectorSpec(Map.of(), null, Map.of());
    }

    public static InjectorSpec env(Map<String, String> env) {
        return new InjectorSpec(env, null, Map.of());
    }

    public boolean hasFile() {
        return fileTemplate != null;
    }

    public boolean isEmpty() {
        return env.isEmpty() && extraVars.isEmpty() && fileTemplate == null;
    }
}
