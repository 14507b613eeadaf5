package io.playengine.process;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Ordered prompt patterns, each mapped to the key of the password that answers it. */
public final class PasswordPromptMap {
    private static final PasswordPromptMap EMPTY = new PasswordPromptMap(List.of());

    private final List<PromptEntry> entries;

    private PasswordPromptMap(List<PromptEntry> entries) {
        this.entries = entries;
    }

    public static PasswordPromptMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<PromptEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Earliest prompt in {@code text} whose key is not in {@code answered}. On equal positions the
     * entry registered first wins.
     */
    public PromptMatch firstMatch(CharSequence text, Set<String> answered) {
        PromptMatch best = null;
        for (PromptEntry entry : entries) {
            if (answered.contains(entry.key())) {
                continue;
            }
            Matcher matcher = entry.pattern().matcher(text);
            if (matcher.find() && (best == null || matcher.start() < best.start())) {
                best = new PromptMatch(entry.key(), matcher.start(), matcher.end());
            }
        }
        return best;
    }

    public record PromptEntry(Pattern pattern, String key) {
    }

    public record PromptMatch(String key, int start, int end) {
    }

    public static final class Builder {
        private final List<PromptEntry> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder prompt(String regex, String key) {
            entries.add(new PromptEntry(Pattern.compile(regex, Pattern.MULTILINE), key));
            return this;
        }

        public PasswordPromptMap build() {
            return new PasswordPromptMap(List.copyOf(entries));
        }
    }
}
