package io.playengine.model;

import java.util.Locale;

public enum ScmType {
    GIT,
    HG,
    SVN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScmType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return GIT;
        }
        for (ScmType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown scm type: " + raw);
    }
}
