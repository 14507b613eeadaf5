package io.playengine.runtime;

import io.playengine.config.EngineConfig;
import io.playengine.config.EngineSettings;
import io.playengine.credential.CredentialInjector;
import io.playengine.lock.ResourceLockManager;
import io.playengine.observability.AuditLogger;
import io.playengine.privatedata.PrivateDataManager;
import io.playengine.process.ProcessRunner;
import io.playengine.storage.JobStore;

/** Collaborators shared by every run task of one engine. */
public record RunDependencies(
        EngineConfig config,
        EngineSettings settings,
        JobStore store,
        CredentialInjector injector,
        PrivateDataManager privateData,
        ProcessRunner runner,
        ResourceLockManager locks,
        AuditLogger audit
) {
    public RunDependencies withRunner(ProcessRunner value) {
        return new RunDependencies(config, settings, store, injector, privateData, value, locks, audit);
    }

    public RunDependencies withSettings(EngineSettings value) {
        return new RunDependencies(config, value, store, injector, privateData, runner, locks, audit);
    }
}
