package io.playengine.model;

import io.playengine.credential.Credential;

import java.util.List;
import java.util.Map;

/**
 * A unit of work handed to the engine by the scheduler. Status and the cancel flag
 * are owned by the {@link io.playengine.storage.JobStore}, not by the definition.
 */
public interface UnifiedJob {
    long id();

    /** Short type tag used in file names, audit rows and the engine extra vars. */
    String kind();

    Map<String, Object> extraVars();

    long timeoutSeconds();

    List<Credential> credentials();
}
