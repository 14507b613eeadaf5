package io.playengine.process;

import java.io.IOException;

/** Runs one prepared command line to completion. */
@FunctionalInterface
public interface ProcessRunner {
    ProcessOutcome run(ProcessRequest request) throws IOException, InterruptedException;
}
