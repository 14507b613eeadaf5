package io.playengine.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.TimeUnit;

/** A running child attached to a terminal. */
public interface TerminalProcess {
    /** Everything the child writes to its terminal. */
    InputStream output();

    /** Keystrokes sent to the child. */
    OutputStream input();

    boolean isAlive();

    boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException;

    int exitValue();

    /** Stops the child and everything it spawned, escalating to a forced kill. */
    void terminate();
}
