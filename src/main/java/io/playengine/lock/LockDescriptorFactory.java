package io.playengine.lock;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface LockDescriptorFactory {
    LockDescriptor open(Path path) throws IOException;
}
