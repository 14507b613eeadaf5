package io.playengine.privatedata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Hands out one fresh, owner-only temporary directory per run. The caller owns the returned
 * {@link PrivateDataDir} and must close it on every path.
 */
public final class PrivateDataManager {
    private static final Logger LOG = LoggerFactory.getLogger(PrivateDataManager.class);
    static final String PREFIX = "playengine_";

    private final Path root;

    public PrivateDataManager(Path root) {
        this.root = root;
    }

    public PrivateDataDir open() throws IOException {
        Files.createDirectories(root);
        Path dir;
        if (root.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            dir = Files.createTempDirectory(root, PREFIX,
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        } else {
            dir = Files.createTempDirectory(root, PREFIX);
        }
        LOG.debug("Opened private data dir {}", dir);
        return new PrivateDataDir(dir);
    }

    public Path root() {
        return root;
    }
}
