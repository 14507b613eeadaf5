package io.playengine.privatedata;

import io.playengine.util.ShellQuoting;

import java.nio.file.Path;
import java.util.List;

/**
 * Wraps a command so it runs under a private {@code ssh-agent}. The key is loaded and then deleted
 * before the real command starts.
 */
public final class SshAgentCommand {
    public static final String AUTH_SOCK = "ssh_auth.sock";

    private SshAgentCommand() {
    }

    public static List<String> wrap(List<String> args, Path keyPath, Path authSock) {
        String key = keyPath.toString();
        String script = "ssh-add " + ShellQuoting.quote(key)
                + " && rm -f " + ShellQuoting.quote(key)
                + " && " + ShellQuoting.commandLine(args);
        return List.of("ssh-agent", "-a", authSock.toString(), "sh", "-c", script);
    }
}
