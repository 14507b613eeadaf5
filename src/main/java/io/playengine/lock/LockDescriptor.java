package io.playengine.lock;

import java.io.Closeable;
import java.io.IOException;

/** An open OS handle on a lock file. */
public interface LockDescriptor extends Closeable {
    /** Blocks until an exclusive advisory lock is held. */
    void lockExclusive() throws IOException;
}
