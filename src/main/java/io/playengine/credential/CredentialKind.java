package io.playengine.credential;

public enum CredentialKind {
    MACHINE("ssh"),
    SCM("scm"),
    NETWORK("net"),
    CLOUD("cloud");

    private final String id;

    CredentialKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static CredentialKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CLOUD;
        }
        for (CredentialKind value : values()) {
            if (value.id.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown credential kind: " + raw);
    }
}
