package io.playengine.process;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

final class SandboxWrapperTest {

    @Test
    void hidesThenShowsThenRunsCommandInCwd() {
        SandboxPolicy policy = new SandboxPolicy(
                "bwrap",
                Path.of("/srv/projects/demo"),
                List.of(Path.of("/srv/projects/demo"), Path.of("/srv/private/playengine_x")),
                List.of(Path.of("/srv"), Path.of("/tmp")),
                false
        );

        List<String> wrapped = SandboxWrapper.wrap(List.of("ansible-playbook", "site.yml"), policy);

        Assertions.assertEquals(List.of(
                "bwrap", "--unshare-pid", "--unshare-ipc", "--unshare-uts", "--die-with-parent",
                "--bind", "/", "/", "--dev", "/dev", "--proc", "/proc",
                "--tmpfs", "/srv", "--tmpfs", "/tmp",
                "--bind", "/srv/projects/demo", "/srv/projects/demo",
                "--bind", "/srv/private/playengine_x", "/srv/private/playengine_x",
                "--chdir", "/srv/projects/demo",
                "ansible-playbook", "site.yml"
        ), wrapped);
    }

    @Test
    void networkIsUnsharedOnlyWhenAsked() {
        SandboxPolicy isolated = new SandboxPolicy("bwrap", Path.of("/w"), List.of(), List.of(), true);
        SandboxPolicy shared = new SandboxPolicy("bwrap", Path.of("/w"), List.of(), List.of(), false);

        Assertions.assertTrue(SandboxWrapper.wrap(List.of("true"), isolated).contains("--unshare-net"));
        Assertions.assertFalse(SandboxWrapper.wrap(List.of("true"), shared).contains("--unshare-net"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new SandboxPolicy(" ", Path.of("/w"), List.of(), List.of(), false));
    }
}
