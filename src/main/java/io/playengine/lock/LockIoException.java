package io.playengine.lock;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

/** I/O failure carrying the errno-style code and message the lock failure logs report. */
public class LockIoException extends IOException {
    private final int errno;
    private final String strerror;

    public LockIoException(int errno, String strerror) {
        super(strerror);
        this.errno = errno;
        this.strerror = strerror;
    }

    public LockIoException(int errno, String strerror, Throwable cause) {
        super(strerror, cause);
        this.errno = errno;
        this.strerror = strerror;
    }

    public int errno() {
        return errno;
    }

    public String strerror() {
        return strerror;
    }

    public static LockIoException from(IOException e) {
        if (e instanceof LockIoException lockIo) {
            return lockIo;
        }
        if (e instanceof NoSuchFileException) {
            return new LockIoException(2, "No such file or directory", e);
        }
        if (e instanceof AccessDeniedException) {
            return new LockIoException(13, "Permission denied", e);
        }
        if (e instanceof FileAlreadyExistsException) {
            return new LockIoException(17, "File exists", e);
        }
        if (e instanceof NotDirectoryException) {
            return new LockIoException(20, "Not a directory", e);
        }
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new LockIoException(5, message, e);
    }
}
