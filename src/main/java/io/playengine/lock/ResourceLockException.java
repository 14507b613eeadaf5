package io.playengine.lock;

import java.io.IOException;
import java.nio.file.Path;

public class ResourceLockException extends IOException {
    public enum Phase {
        OPEN,
        ACQUIRE
    }

    private final Phase phase;
    private final int errno;
    private final String strerror;
    private final Path path;

    public ResourceLockException(Phase phase, Path path, LockIoException cause) {
        super(describe(phase, path, cause.errno(), cause.strerror()), cause);
        this.phase = phase;
        this.errno = cause.errno();
        this.strerror = cause.strerror();
        this.path = path;
    }

    public Phase phase() {
        return phase;
    }

    public int errno() {
        return errno;
    }

    public String strerror() {
        return strerror;
    }

    public Path path() {
        return path;
    }

    static String describe(Phase phase, Path path, int errno, String strerror) {
        if (phase == Phase.OPEN) {
            return "I/O error(" + errno + ") while trying to open lock file [" + path + "]: " + strerror;
        }
        return "I/O error(" + errno + ") while trying to aquire lock on file [" + path + "]: " + strerror;
    }
}
