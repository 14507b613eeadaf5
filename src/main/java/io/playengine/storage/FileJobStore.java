package io.playengine.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.playengine.model.JobStatus;
import io.playengine.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One JSON document per job under {@code <root>/<id>.json}, replaced atomically on every update.
 * Cancellation is a separate {@code <id>.cancel} marker so a cancel request never races a state write.
 */
public final class FileJobStore implements JobStore {
    private final Path root;

    public FileJobStore(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create job store directory: " + root, e);
        }
    }

    @Override
    public synchronized void register(long id) {
        if (!Files.exists(stateFile(id))) {
            write(new JobState(id, JobStatus.NEW, false, Map.of()));
        }
    }

    public void requestCancel(long id) {
        Path marker = cancelFile(id);
        try {
            if (!Files.exists(marker)) {
                Files.writeString(marker, "", StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write cancel marker: " + marker, e);
        }
    }

    public boolean exists(long id) {
        return Files.exists(stateFile(id));
    }

    @Override
    public synchronized JobState load(long id) {
        Path file = stateFile(id);
        if (!Files.exists(file)) {
            throw new JobStoreException("Unknown job: " + id);
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            Map<String, Object> fields = new LinkedHashMap<>();
            JsonNode fieldsNode = node.path("fields");
            if (fieldsNode.isObject()) {
                fieldsNode.fieldNames().forEachRemaining(name ->
                        fields.put(name, Jsons.mapper().convertValue(fieldsNode.get(name), Object.class)));
            }
            JobStatus status = JobStatus.fromString(node.path("status").asText(""));
            return new JobState(id, status, Files.exists(cancelFile(id)), fields);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read job state: " + file, e);
        }
    }

    @Override
    public synchronized JobState update(long id, Map<String, Object> fields) {
        JobState current = load(id);
        JobStatus next = JobStatuses.transition(id, current.status(), fields);
        Map<String, Object> merged = new LinkedHashMap<>(current.fields());
        merged.putAll(fields);
        JobState updated = new JobState(id, next, current.cancelFlag(), merged);
        write(updated);
        return updated;
    }

    private void write(JobState state) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", state.id());
        doc.put("status", state.status().value());
        doc.put("fields", state.fields());
        Path target = stateFile(state.id());
        Path tmp = root.resolve(state.id() + ".json.tmp");
        try {
            Files.writeString(tmp, Jsons.toJson(doc), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write job state: " + target, e);
        }
    }

    private Path stateFile(long id) {
        return root.resolve(id + ".json");
    }

    private Path cancelFile(long id) {
        return root.resolve(id + ".cancel");
    }
}
