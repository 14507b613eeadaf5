package io.playengine.privatedata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

public final class PrivateDataDir implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PrivateDataDir.class);
    private static final Set<PosixFilePermission> OWNER_RW = PosixFilePermissions.fromString("rw-------");

    private final Path path;
    private final boolean posix;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    PrivateDataDir(Path path) {
        this.path = path;
        this.posix = path.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    public Path path() {
        return path;
    }

    public Path resolve(String name) {
        return path.resolve(name);
    }

    /** Writes {@code content} to {@code <dir>/<name>} readable by the owner only. */
    public Path writeSecret(String name, String content) throws IOException {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new IllegalArgumentException("invalid private data file name: " + name);
        }
        ensureOpen();
        Path target = path.resolve(name);
        if (posix) {
            Files.deleteIfExists(target);
            Files.createFile(target, PosixFilePermissions.asFileAttribute(OWNER_RW));
        }
        Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8);
        return target;
    }

    /** Writes {@code content} to a uniquely named owner-only file and returns its path. */
    public Path writeSecretTempFile(String prefix, String content) throws IOException {
        ensureOpen();
        Path target;
        if (posix) {
            FileAttribute<Set<PosixFilePermission>> attr = PosixFilePermissions.asFileAttribute(OWNER_RW);
            target = Files.createTempFile(path, prefix, "", attr);
        } else {
            target = Files.createTempFile(path, prefix, "");
        }
        Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8);
        return target;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Removes the directory tree. Only the first call does anything; failures are logged. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!Files.exists(path)) {
            return;
        }
        try {
            Files.walkFileTree(path, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
            LOG.debug("Removed private data dir {}", path);
        } catch (IOException e) {
            LOG.warn("Failed to remove private data dir {}: {}", path, e.getMessage());
        }
    }

    private void ensureOpen() throws IOException {
        if (closed.get()) {
            throw new IOException("private data dir already closed: " + path);
        }
    }
}
