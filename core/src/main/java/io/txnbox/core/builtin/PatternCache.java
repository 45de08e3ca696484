package io.txnbox.core.builtin;

import io.txnbox.core.error.ConfigSyntaxException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled regular expressions of one configuration, shared by every {@code rxp} case that uses
 * the same expression text and flags. Created by the {@code with} type initializer and cleared
 * when the configuration is closed.
 */
public final class PatternCache {

    private record Key(String regex, int flags) {}

    private final Map<Key, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * @throws ConfigSyntaxException if {@code regex} is not a valid regular expression
     */
    public Pattern compile(String regex, int flags) {
        try {
            return patterns.computeIfAbsent(new Key(regex, flags), k -> Pattern.compile(k.regex(), k.flags()));
        } catch (PatternSyntaxException e) {
            throw new ConfigSyntaxException(
                    String.format("Regular expression \"%s\" is invalid: %s", regex, e.getDescription()), e);
        }
    }

    public int size() {
        return patterns.size();
    }

    public void clear() {
        patterns.clear();
    }
}
