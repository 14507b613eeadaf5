package io.playengine.lock;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

public final class LockHandle implements AutoCloseable {
    private final ResourceLockManager owner;
    private final Path path;
    private final LockDescriptor descriptor;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(ResourceLockManager owner, Path path, LockDescriptor descriptor) {
        this.owner = owner;
        this.path = path;
        this.descriptor = descriptor;
    }

    public Path path() {
        return path;
    }

    public boolean isReleased() {
        return released.get();
    }

    LockDescriptor descriptor() {
        return descriptor;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        owner.release(this);
    }
}
