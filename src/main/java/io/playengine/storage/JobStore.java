package io.playengine.storage;

import java.util.Map;

/**
 * Where the engine reads job state from and writes transitions to. Field names follow
 * {@link JobFields}. A {@code status} that changes an already terminal job is rejected.
 */
public interface JobStore {
    /** Creates a {@code new} record for {@code id} unless one exists. */
    void register(long id);

    JobState load(long id);

    JobState update(long id, Map<String, Object> fields);
}
