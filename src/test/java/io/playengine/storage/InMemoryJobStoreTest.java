package io.playengine.storage;

import io.playengine.model.JobStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

final class InMemoryJobStoreTest {

    @Test
    void historyKeepsEveryUpdateInOrderIncludingNulls() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.register(1L);
        store.update(1L, Map.of(JobFields.STATUS, "running"));
        Map<String, Object> withNull = new HashMap<>();
        withNull.put(JobFields.JOB_EXPLANATION, null);
        store.update(1L, withNull);
        store.update(1L, Map.of(JobFields.STATUS, JobStatus.SUCCESSFUL));

        Assertions.assertEquals(3, store.history().size());
        Assertions.assertTrue(store.history().get(1).fields().containsKey(JobFields.JOB_EXPLANATION));
        Assertions.assertEquals(JobStatus.SUCCESSFUL, store.load(1L).status());
        Assertions.assertThrows(JobStoreException.class, () -> store.update(1L, Map.of(JobFields.STATUS, "canceled")));
    }

    @Test
    void cancelRequestedBeforeRegistrationIsKept() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.requestCancel(2L);
        store.register(2L);

        Assertions.assertTrue(store.load(2L).cancelFlag());
        Assertions.assertEquals(JobStatus.NEW, store.load(2L).status());
    }
}
