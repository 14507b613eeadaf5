package io.playengine.model;

import io.playengine.credential.Credential;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Job(
        long id,
        JobType jobType,
        String playbook,
        Path projectPath,
        String inventory,
        Credential credential,
        Credential cloudCredential,
        Credential networkCredential,
        Map<String, Object> extraVars,
        String limit,
        int verbosity,
        int forks,
        String jobTags,
        String skipTags,
        String startAtTask,
        boolean becomeEnabled,
        boolean diffMode,
        Map<String, String> launchPasswords,
        long timeoutSeconds
) implements UnifiedJob {
    public Job {
        if (playbook == null || playbook.isBlank()) {
            throw new IllegalArgumentException("job playbook cannot be empty: " + id);
        }
        if (projectPath == null) {
            throw new IllegalArgumentException("job project path cannot be empty: " + id);
        }
        jobType = jobType == null ? JobType.RUN : jobType;
        inventory = inventory == null || inventory.isBlank() ? "localhost," : inventory;
        extraVars = extraVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraVars));
        launchPasswords = launchPasswords == null ? Map.of() : Map.copyOf(launchPasswords);
    }

    public static Job of(long id, String playbook, Path projectPath) {
        return new Job(id, JobType.RUN, playbook, projectPath, null, null, null, null, Map.of(),
                null, 0, 0, null, null, null, false, false, Map.of(), 0L);
    }

    @Override
    public String kind() {
        return "job";
    }

    @Override
    public List<Credential> credentials() {
        List<Credential> out = new ArrayList<>(3);
        if (credential != null) {
            out.add(credential);
        }
        if (cloudCredential != null) {
            out.add(cloudCredential);
        }
        if (networkCredential != null) {
            out.add(networkCredential);
        }
        return out;
    }

    public Job withCredential(Credential value) {
        return new Job(id, jobType, playbook, projectPath, inventory, value, cloudCredential, networkCredential,
                extraVars, limit, verbosity, forks, jobTags, skipTags, startAtTask, becomeEnabled, diffMode,
                launchPasswords, timeoutSeconds);
    }

    public Job withCloudCredential(Credential value) {
        return new Job(id, jobType, playbook, projectPath, inventory, credential, value, networkCredential,
                extraVars, limit, verbosity, forks, jobTags, skipTags, startAtTask, becomeEnabled, diffMode,
                launchPasswords, timeoutSeconds);
    }

    public Job withNetworkCredential(Credential value) {
        return new Job(id, jobType, playbook, projectPath, inventory, credential, cloudCredential, value,
                extraVars, limit, verbosity, forks, jobTags, skipTags, startAtTask, becomeEnabled, diffMode,
                launchPasswords, timeoutSeconds);
    }

    public Job withExtraVars(Map<String, Object> value) {
        return new Job(id, jobType, playbook, projectPath, inventory, credential, cloudCredential, networkCredential,
                value, limit, verbosity, forks, jobTags, skipTags, startAtTask, becomeEnabled, diffMode,
                launchPasswords, timeoutSeconds);
    }

    public Job withLaunchPasswords(Map<String, String> value) {
        return new Job(id, jobType, playbook, projectPath, inventory, credential, cloudCredential, networkCredential,
                extraVars, limit, verbosity, forks, jobTags, skipTags, startAtTask, becomeEnabled, diffMode,
                value, timeoutSeconds);
    }

    public Job withTimeoutSeconds(long value) {
        return new Job(id, jobType, playbook, projectPath, inventory, credential, cloudCredential, networkCredential,
                extraVars, limit, verbosity, forks, jobTags, skipTags, startAtTask, becomeEnabled, diffMode,
                launchPasswords, value);
    }
}
