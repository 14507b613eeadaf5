package io.playengine.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Advisory {@code flock}-style lock through {@link FileChannel#lock()}. */
public final class FileChannelLockDescriptor implements LockDescriptor {
    private final FileChannel channel;
    private FileLock lock;

    private FileChannelLockDescriptor(FileChannel channel) {
        this.channel = channel;
    }

    public static LockDescriptor open(Path path) throws IOException {
        try {
            return new FileChannelLockDescriptor(
                    FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE));
        } catch (IOException e) {
            throw LockIoException.from(e);
        }
    }

    @Override
    public void lockExclusive() throws IOException {
        try {
            lock = channel.lock();
        } catch (IOException e) {
            throw LockIoException.from(e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
        } finally {
            channel.close();
        }
    }
}
