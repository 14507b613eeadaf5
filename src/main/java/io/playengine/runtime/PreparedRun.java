package io.playengine.runtime;

import io.playengine.process.PasswordPromptMap;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task-specific part of a run: the command line before sandboxing, extra environment, working
 * directory, prompt table and the {@code [field, placeholder]} pairs reported as output replacements.
 */
public record PreparedRun(
        List<String> args,
        Map<String, String> env,
        Path cwd,
        PasswordPromptMap prompts,
        List<List<String>> outputReplacements
) {
    public PreparedRun {
        args = List.copyOf(args);
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        prompts = prompts == null ? PasswordPromptMap.empty() : prompts;
        outputReplacements = outputReplacements == null ? List.of() : List.copyOf(outputReplacements);
    }
}
