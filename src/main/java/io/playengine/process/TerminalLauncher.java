package io.playengine.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface TerminalLauncher {
    TerminalProcess launch(List<String> args, Path cwd, Map<String, String> env) throws IOException;
}
