package io.playengine.storage;

import io.playengine.model.JobStatus;

import java.util.Map;

final class JobStatuses {
    private JobStatuses() {
    }

    /** Status after applying {@code fields}; a terminal status is final. */
    static JobStatus transition(long id, JobStatus current, Map<String, Object> fields) {
        Object raw = fields.get(JobFields.STATUS);
        if (raw == null) {
            return current;
        }
        JobStatus next = raw instanceof JobStatus s ? s : JobStatus.fromString(String.valueOf(raw));
        if (current.isTerminal() && next != current) {
            throw new JobStoreException("Job " + id + " is already " + current.value() + ", cannot move to " + next.value());
        }
        return next;
    }
}
