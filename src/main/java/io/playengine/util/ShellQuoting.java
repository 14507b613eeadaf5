package io.playengine.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class ShellQuoting {
    private static final Pattern SAFE = Pattern.compile("^[A-Za-z0-9@%+=:,./_-]+$");

    private ShellQuoting() {
    }

    public static String quote(String arg) {
        if (arg == null || arg.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(arg).matches()) {
            return arg;
        }
        return "'" + escapeForSingleQuotes(arg) + "'";
    }

    /** Body of a single-quoted word: each {@code '} closes the quote, emits a quoted quote and reopens. */
    public static String escapeForSingleQuotes(String arg) {
        return arg.replace("'", "'\"'\"'");
    }

    public static String commandLine(List<String> args) {
        List<String> quoted = new ArrayList<>(args.size());
        for (String arg : args) {
            quoted.add(quote(arg));
        }
        return String.join(" ", quoted);
    }

    public static String commandLine(String... args) {
        return commandLine(List.of(args));
    }
}
