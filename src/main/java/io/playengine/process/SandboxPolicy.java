package io.playengine.process;

import java.nio.file.Path;
import java.util.List;

/**
 * What the sandboxed process may see. {@code hidePaths} are masked with empty tmpfs mounts,
 * {@code showPaths} are bound back in on top of them.
 */
public record SandboxPolicy(
        String command,
        Path cwd,
        List<Path> showPaths,
        List<Path> hidePaths,
        boolean unshareNetwork
) {
    public SandboxPolicy {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("sandbox command cannot be empty");
        }
        if (cwd == null) {
            throw new IllegalArgumentException("sandbox cwd cannot be empty");
        }
        showPaths = showPaths == null ? List.of() : List.copyOf(showPaths);
        hidePaths = hidePaths == null ? List.of() : List.copyOf(hidePaths);
    }
}
