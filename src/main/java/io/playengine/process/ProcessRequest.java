package io.playengine.process;

import io.playengine.model.UnifiedJob;

import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record ProcessRequest(
        UnifiedJob job,
        List<String> args,
        Path cwd,
        Map<String, String> env,
        PasswordPromptMap prompts,
        Map<String, String> passwords,
        Writer stdout,
        CancelCheck cancelCheck,
        long timeoutSeconds
) {
    public ProcessRequest {
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("process args cannot be empty");
        }
        args = List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
        prompts = prompts == null ? PasswordPromptMap.empty() : prompts;
        passwords = passwords == null ? Map.of() : Map.copyOf(passwords);
        cancelCheck = cancelCheck == null ? CancelCheck.NEVER : cancelCheck;
    }
}
