package io.playengine.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal INI writer used for the cloud inventory plugin configs.
 * Sections and keys keep insertion order; setting a key twice overwrites it in place.
 */
public final class IniDocument {
    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

    public IniDocument section(String name) {
        sections.computeIfAbsent(name, k -> new LinkedHashMap<>());
        return this;
    }

    public IniDocument set(String section, String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("ini key cannot be empty");
        }
        String rendered = value == null ? "" : String.valueOf(value);
        if (rendered.indexOf('\n') >= 0 || rendered.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("ini value for " + section + "." + key + " cannot span lines");
        }
        sections.computeIfAbsent(section, k -> new LinkedHashMap<>()).put(key, rendered);
        return this;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Map<String, String>> section : sections.entrySet()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append('[').append(section.getKey()).append("]\n");
            for (Map.Entry<String, String> entry : section.getValue().entrySet()) {
                sb.append(entry.getKey()).append(" = ").append(entry.getValue()).append('\n');
            }
        }
        return sb.toString();
    }
}
