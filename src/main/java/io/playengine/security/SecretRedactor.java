package io.playengine.security;

import io.playengine.util.Jsons;
import io.playengine.util.ShellQuoting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Value-based redaction of the secrets known to one run. Every persisted record and every stdout line
 * passes through here; key-name hints alone are not enough because a secret can land under any name.
 */
public final class SecretRedactor {
    public static final String HIDDEN = "**********";

    private static final Pattern SENSITIVE_ENV_KEY = Pattern.compile("API|TOKEN|KEY|SECRET|PASS", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL_WITH_PASSWORD = Pattern.compile("^.*?://[^:]+:(.*?)@.*?$");
    private static final Set<String> ENV_KEY_ALLOWLIST = Set.of("REST_API_URL", "AWS_ACCESS_KEY", "AWS_ACCESS_KEY_ID");

    private static final int ENCODING_DEPTH = 3;

    private static final SecretRedactor NONE = new SecretRedactor(List.of());

    private final List<String> secrets;

    private SecretRedactor(List<String> secrets) {
        this.secrets = secrets;
    }

    public static SecretRedactor none() {
        return NONE;
    }

    public static SecretRedactor of(Collection<String> values) {
        Set<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            addWithEncodings(unique, value);
            // Stdout is redacted line by line, so each line of a PEM block must match on its own.
            if (value.indexOf('\n') >= 0) {
                for (String line : value.split("\\r?\\n")) {
                    String trimmed = line.strip();
                    if (!trimmed.isEmpty()) {
                        addWithEncodings(unique, trimmed);
                    }
                }
            }
        }
        List<String> ordered = new ArrayList<>(unique);
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        return new SecretRedactor(List.copyOf(ordered));
    }

    /**
     * A secret reaches persisted records inside {@code -e} JSON, inside the single-quoted ssh-agent
     * script and inside the JSON of {@code job_args}, in any nesting of those. Each nesting level
     * escapes it differently.
     */
    private static void addWithEncodings(Set<String> out, String value) {
        Set<String> level = new LinkedHashSet<>();
        level.add(value);
        for (int depth = 0; depth < ENCODING_DEPTH; depth++) {
            Set<String> next = new LinkedHashSet<>();
            for (String form : level) {
                next.add(jsonEscaped(form));
                next.add(ShellQuoting.escapeForSingleQuotes(form));
            }
            next.removeAll(out);
            next.removeAll(level);
            out.addAll(level);
            level = next;
        }
        out.addAll(level);
    }

    static String jsonEscaped(String value) {
        String quoted = Jsons.toCompactJson(value);
        return quoted.substring(1, quoted.length() - 1);
    }

    public List<String> secrets() {
        return secrets;
    }

    public boolean isEmpty() {
        return secrets.isEmpty();
    }

    public String redact(String text) {
        if (text == null || text.isEmpty() || secrets.isEmpty()) {
            return text;
        }
        String out = text;
        for (String secret : secrets) {
            if (out.contains(secret)) {
                out = out.replace(secret, HIDDEN);
            }
        }
        return out;
    }

    public List<String> redact(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(redact(value));
        }
        return out;
    }

    public Map<String, Object> redact(Map<String, ?> fields) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            out.put(entry.getKey(), redactValue(entry.getValue()));
        }
        return out;
    }

    public Object redactValue(Object value) {
        if (value instanceof String s) {
            return redact(s);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), redactValue(entry.getValue()));
            }
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(redactValue(item));
            }
            return out;
        }
        return value;
    }

    /**
     * Copy of {@code env} fit for persisting: sensitive-looking keys and URLs carrying a password are
     * hidden, and the remaining values are redacted against this run's secrets.
     */
    public Map<String, String> safeEnv(Map<String, String> env) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : env.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (isSensitiveEnvKey(key)) {
                out.put(key, HIDDEN);
            } else if (value != null && URL_WITH_PASSWORD.matcher(value).matches()) {
                out.put(key, HIDDEN);
            } else {
                out.put(key, redact(value));
            }
        }
        return out;
    }

    static boolean isSensitiveEnvKey(String key) {
        if (key == null || ENV_KEY_ALLOWLIST.contains(key)) {
            return false;
        }
        String upper = key.toUpperCase(Locale.ROOT);
        if (upper.startsWith("ANSIBLE_") && !upper.startsWith("ANSIBLE_NET_")) {
            return false;
        }
        return SENSITIVE_ENV_KEY.matcher(key).find();
    }
}
