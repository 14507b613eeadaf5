package io.playengine.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;

/**
 * Exclusive advisory locks on filesystem paths. Holders in this JVM are serialized by a per-path
 * semaphore, other processes by the OS lock. Acquisition waits without a timeout.
 */
public final class ResourceLockManager {
    private static final Logger LOG = LoggerFactory.getLogger(ResourceLockManager.class);

    private final LockDescriptorFactory descriptors;
    private final ConcurrentMap<Path, Semaphore> local = new ConcurrentHashMap<>();

    public ResourceLockManager() {
        this(FileChannelLockDescriptor::open);
    }

    public ResourceLockManager(LockDescriptorFactory descriptors) {
        this.descriptors = descriptors;
    }

    public LockHandle acquire(Path path) throws ResourceLockException, InterruptedException {
        Path key = path.toAbsolutePath().normalize();
        Semaphore gate = local.computeIfAbsent(key, k -> new Semaphore(1));
        gate.acquire();
        LockDescriptor descriptor;
        try {
            descriptor = descriptors.open(path);
        } catch (IOException e) {
            gate.release();
            LockIoException io = LockIoException.from(e);
            ResourceLockException failure = new ResourceLockException(ResourceLockException.Phase.OPEN, path, io);
            LOG.error(failure.getMessage());
            throw failure;
        } catch (RuntimeException e) {
            gate.release();
            throw e;
        }
        try {
            descriptor.lockExclusive();
        } catch (IOException e) {
            LockIoException io = LockIoException.from(e);
            ResourceLockException failure = new ResourceLockException(ResourceLockException.Phase.ACQUIRE, path, io);
            try {
                descriptor.close();
            } catch (IOException closeError) {
                failure.addSuppressed(closeError);
            } finally {
                gate.release();
            }
            LOG.error(failure.getMessage());
            throw failure;
        } catch (RuntimeException e) {
            // OverlappingFileLockException when another manager in this JVM holds the same file.
            try {
                descriptor.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            } finally {
                gate.release();
            }
            LOG.error("Failed to acquire lock on file [{}]: {}", path, e.toString());
            throw e;
        }
        LOG.debug("Acquired lock on {}", path);
        return new LockHandle(this, path, descriptor);
    }

    public void release(LockHandle handle) {
        if (handle == null || !handle.markReleased()) {
            return;
        }
        try {
            handle.descriptor().close();
        } catch (IOException e) {
            LOG.warn("Failed to close lock file [{}]: {}", handle.path(), e.getMessage());
        } finally {
            Semaphore gate = local.get(handle.path().toAbsolutePath().normalize());
            if (gate != null) {
                gate.release();
            }
        }
        LOG.debug("Released lock on {}", handle.path());
    }
}
