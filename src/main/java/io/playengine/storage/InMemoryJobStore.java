package io.playengine.storage;

import io.playengine.model.JobStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Job store kept in memory. Also records every update in order, which embedding callers can inspect. */
public final class InMemoryJobStore implements JobStore {
    private final ConcurrentMap<Long, JobState> states = new ConcurrentHashMap<>();
    private final List<Update> history = new ArrayList<>();

    @Override
    public void register(long id) {
        states.putIfAbsent(id, new JobState(id, JobStatus.NEW, false, Map.of()));
    }

    public void requestCancel(long id) {
        states.compute(id, (k, current) -> {
            JobState base = current == null ? new JobState(id, JobStatus.NEW, false, Map.of()) : current;
            return new JobState(id, base.status(), true, base.fields());
        });
    }

    @Override
    public JobState load(long id) {
        JobState state = states.get(id);
        if (state == null) {
            throw new JobStoreException("Unknown job: " + id);
        }
        return state;
    }

    @Override
    public synchronized JobState update(long id, Map<String, Object> fields) {
        JobState current = load(id);
        JobStatus next = JobStatuses.transition(id, current.status(), fields);
        Map<String, Object> merged = new LinkedHashMap<>(current.fields());
        merged.putAll(fields);
        JobState updated = new JobState(id, next, current.cancelFlag(), merged);
        states.put(id, updated);
        history.add(new Update(id, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        return updated;
    }

    public synchronized List<Update> history() {
        return List.copyOf(history);
    }

    public record Update(long id, Map<String, Object> fields) {
    }
}
