package io.playengine;

import io.playengine.cli.PlayEngineCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PlayEngineCommand()).execute(args);
        System.exit(code);
    }
}
