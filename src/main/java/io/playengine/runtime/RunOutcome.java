package io.playengine.runtime;

import io.playengine.model.JobStatus;

import java.nio.file.Path;

public record RunOutcome(
        long jobId,
        JobStatus status,
        int exitCode,
        String resultTraceback,
        String explanation,
        Path stdoutFile
) {
    public boolean successful() {
        return status == JobStatus.SUCCESSFUL;
    }
}
