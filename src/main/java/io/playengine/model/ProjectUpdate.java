package io.playengine.model;

import io.playengine.credential.Credential;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProjectUpdate(
        long id,
        ScmType scmType,
        String scmUrl,
        String scmBranch,
        boolean scmClean,
        boolean scmDeleteOnUpdate,
        boolean scmAcceptHostkey,
        Path projectPath,
        Credential credential,
        Map<String, Object> extraVars,
        int verbosity,
        long timeoutSeconds
) implements UnifiedJob {
    public ProjectUpdate {
        if (projectPath == null) {
            throw new IllegalArgumentException("project update path cannot be empty: " + id);
        }
        if (scmUrl == null || scmUrl.isBlank()) {
            throw new IllegalArgumentException("project update scm url cannot be empty: " + id);
        }
        scmType = scmType == null ? ScmType.GIT : scmType;
        scmBranch = scmBranch == null || scmBranch.isBlank() ? "HEAD" : scmBranch;
        extraVars = extraVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraVars));
    }

    public static ProjectUpdate of(long id, ScmType scmType, String scmUrl, Path projectPath) {
        return new ProjectUpdate(id, scmType, scmUrl, null, false, false, false, projectPath, null, Map.of(), 0, 0L);
    }

    @Override
    public String kind() {
        return "project_update";
    }

    @Override
    public List<Credential> credentials() {
        return credential == null ? List.of() : List.of(credential);
    }

    /** Lock file shared by every update of the same checkout. */
    public Path lockFile() {
        Path name = projectPath.getFileName();
        return projectPath.resolveSibling((name == null ? "project" : name.toString()) + ".lock");
    }

    public ProjectUpdate withCredential(Credential value) {
        return new ProjectUpdate(id, scmType, scmUrl, scmBranch, scmClean, scmDeleteOnUpdate, scmAcceptHostkey,
                projectPath, value, extraVars, verbosity, timeoutSeconds);
    }

    public ProjectUpdate withAcceptHostkey(boolean value) {
        return new ProjectUpdate(id, scmType, scmUrl, scmBranch, scmClean, scmDeleteOnUpdate, value,
                projectPath, credential, extraVars, verbosity, timeoutSeconds);
    }
}
