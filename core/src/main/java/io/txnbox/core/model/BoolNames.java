package io.txnbox.core.model;

import java.util.Locale;
import java.util.Map;

/** Names recognized as boolean literals, compared case-insensitively. */
public final class BoolNames {

    /** Result of a name lookup. */
    public enum BoolTag {
        INVALID,
        TRUE,
        FALSE
    }

    private static final Map<String, BoolTag> NAMES = Map.ofEntries(
            Map.entry("true", BoolTag.TRUE),
            Map.entry("1", BoolTag.TRUE),
            Map.entry("on", BoolTag.TRUE),
            Map.entry("enable", BoolTag.TRUE),
            Map.entry("y", BoolTag.TRUE),
            Map.entry("yes", BoolTag.TRUE),
            Map.entry("false", BoolTag.FALSE),
            Map.entry("0", BoolTag.FALSE),
            Map.entry("off", BoolTag.FALSE),
            Map.entry("disable", BoolTag.FALSE),
            Map.entry("n", BoolTag.FALSE),
            Map.entry("no", BoolTag.FALSE));

    private BoolNames() {}

    /** Returns the tag for {@code name}, or {@link BoolTag#INVALID} if it is not a boolean name. */
    public static BoolTag lookup(CharSequence name) {
        return NAMES.getOrDefault(name.toString().toLowerCase(Locale.ROOT), BoolTag.INVALID);
    }

    /** The primary name of a boolean value. */
    public static String nameOf(boolean value) {
        return value ? "true" : "false";
    }
}
