package io.playengine.model;

public enum JobType {
    RUN,
    CHECK;

    public static JobType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return RUN;
        }
        for (JobType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + raw);
    }
}
