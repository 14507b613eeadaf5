package io.playengine.process;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Builds the bubblewrap command line that confines a run. */
public final class SandboxWrapper {
    private SandboxWrapper() {
    }

    public static List<String> wrap(List<String> argv, SandboxPolicy policy) {
        List<String> out = new ArrayList<>(argv.size() + 24);
        out.add(policy.command());
        out.add("--unshare-pid");
        out.add("--unshare-ipc");
        out.add("--unshare-uts");
        if (policy.unshareNetwork()) {
            out.add("--unshare-net");
        }
        out.add("--die-with-parent");
        out.add("--bind");
        out.add("/");
        out.add("/");
        out.add("--dev");
        out.add("/dev");
        out.add("--proc");
        out.add("/proc");
        for (Path hidden : policy.hidePaths()) {
            out.add("--tmpfs");
            out.add(hidden.toString());
        }
        for (Path shown : policy.showPaths()) {
            out.add("--bind");
            out.add(shown.toString());
            out.add(shown.toString());
        }
        out.add("--chdir");
        out.add(policy.cwd().toString());
        out.addAll(argv);
        return out;
    }
}
