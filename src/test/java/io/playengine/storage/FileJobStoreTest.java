package io.playengine.storage;

import io.playengine.model.JobStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class FileJobStoreTest {

    @Test
    void updatesMergeFieldsAndSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("playengine-test-store-");
        try {
            FileJobStore store = new FileJobStore(root);
            store.register(5L);
            store.register(5L);
            Assertions.assertEquals(JobStatus.NEW, store.load(5L).status());

            store.update(5L, Map.of(JobFields.STATUS, "running", JobFields.CELERY_TASK_ID, ""));
            Map<String, Object> record = new LinkedHashMap<>();
            record.put(JobFields.JOB_ARGS, "[\"ansible-playbook\"]");
            record.put(JobFields.JOB_ENV, Map.of("HOME", "/root"));
            record.put(JobFields.OUTPUT_REPLACEMENTS, List.of(List.of("scm_password", "**********")));
            store.update(5L, record);

            JobState reloaded = new FileJobStore(root).load(5L);
            Assertions.assertEquals(JobStatus.RUNNING, reloaded.status());
            Assertions.assertEquals("[\"ansible-playbook\"]", reloaded.field(JobFields.JOB_ARGS));
            Assertions.assertEquals(Map.of("HOME", "/root"), reloaded.field(JobFields.JOB_ENV));
            Assertions.assertEquals(List.of(List.of("scm_password", "**********")),
                    reloaded.field(JobFields.OUTPUT_REPLACEMENTS));
            Assertions.assertFalse(Files.exists(root.resolve("5.json.tmp")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelMarkerSetsTheFlag() throws Exception {
        Path root = Files.createTempDirectory("playengine-test-store-cancel-");
        try {
            FileJobStore store = new FileJobStore(root);
            store.register(6L);
            Assertions.assertFalse(store.load(6L).cancelFlag());

            store.requestCancel(6L);
            store.requestCancel(6L);

            Assertions.assertTrue(store.load(6L).cancelFlag());
            Assertions.assertTrue(store.update(6L, Map.of(JobFields.STATUS, "running")).cancelFlag());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void terminalStatusIsFinal() throws Exception {
        Path root = Files.createTempDirectory("playengine-test-store-terminal-");
        try {
            FileJobStore store = new FileJobStore(root);
            store.register(7L);
            store.update(7L, Map.of(JobFields.STATUS, "running"));
            store.update(7L, Map.of(JobFields.STATUS, "failed", JobFields.RESULT_TRACEBACK, "boom"));

            Assertions.assertThrows(JobStoreException.class, () -> store.update(7L, Map.of(JobFields.STATUS, "running")));
            store.update(7L, Map.of(JobFields.STATUS, "failed"));
            Assertions.assertEquals(JobStatus.FAILED, store.load(7L).status());
            Assertions.assertThrows(JobStoreException.class, () -> store.load(99L));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
