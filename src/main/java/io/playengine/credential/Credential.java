package io.playengine.credential;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a stored credential. Secret inputs may still be in their encrypted
 * {@code $encrypted$...} form; only {@link CredentialInjector} decrypts them.
 */
public record Credential(String name, CredentialType type, Map<String, Object> inputs) {
    public Credential {
        if (type == null) {
            throw new IllegalArgumentException("credential type cannot be null");
        }
        name = name == null || name.isBlank() ? type.name() : name;
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static Credential of(CredentialType type, Map<String, Object> inputs) {
        return new Credential(null, type, inputs);
    }

    public Object rawInput(String field) {
        return inputs.get(field);
    }

    public boolean has(String field) {
        Object value = inputs.get(field);
        if (value == null) {
            return false;
        }
        return !(value instanceof String s) || !s.isEmpty();
    }

    public boolean flag(String field) {
        Object value = inputs.get(field);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return "true".equalsIgnoreCase(s) || "1".equals(s) || "yes".equalsIgnoreCase(s);
        }
        return false;
    }

    public Credential withInput(String field, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(inputs);
        next.put(field, value);
        return new Credential(name, type, next);
    }
}
