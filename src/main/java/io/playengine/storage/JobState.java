package io.playengine.storage;

import io.playengine.model.JobStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Persisted view of a job: lifecycle status, cancel flag and every field the engine has written. */
public record JobState(long id, JobStatus status, boolean cancelFlag, Map<String, Object> fields) {
    public JobState {
        status = status == null ? JobStatus.NEW : status;
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
