package io.playengine.process;

import io.playengine.model.JobStatus;

public record ProcessOutcome(JobStatus status, int exitCode, String explanation) {
    public static ProcessOutcome of(JobStatus status, int exitCode) {
        return new ProcessOutcome(status, exitCode, null);
    }
}
