package io.playengine.model;

import java.util.Locale;

public enum JobStatus {
    NEW,
    PENDING,
    WAITING,
    RUNNING,
    SUCCESSFUL,
    FAILED,
    CANCELED,
    ERROR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == SUCCESSFUL || this == FAILED || this == CANCELED || this == ERROR;
    }

    public static JobStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEW;
        }
        for (JobStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + raw);
    }
}
