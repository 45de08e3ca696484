package io.txnbox.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pipeline stages at which compiled directives can run. The declaration order is used for
 * indexing only. {@link #INVALID} is the sentinel for unrecognized names and is never a legal
 * attachment point.
 *
 * <p>Names are looked up case-insensitively; several stages have an alias.
 */
public enum Hook {
    INVALID(false),
    POST_LOAD(false, "post-load"),
    TXN_START(true, "txn-open"),
    CREQ(true, "ua-req", "creq"),
    PREQ(true, "proxy-req", "preq"),
    URSP(true, "upstream-resp", "ursp"),
    PRSP(true, "proxy-resp", "prsp"),
    PRE_REMAP(true, "pre-remap"),
    POST_REMAP(true, "post-remap"),
    TXN_CLOSE(true, "txn-close"),
    REMAP(false, "remap"),
    MSG(false, "msg");

    private static final Map<String, Hook> BY_NAME;

    static {
        Map<String, Hook> names = new HashMap<>();
        for (Hook hook : values()) {
            for (String name : hook.names) {
                names.put(name, hook);
            }
        }
        BY_NAME = Collections.unmodifiableMap(names);
    }

    private final boolean transactionHook;
    private final List<String> names;

    Hook(boolean transactionHook, String... names) {
        this.transactionHook = transactionHook;
        this.names = List.of(names);
    }

    /**
     * Looks up a hook by any of its names.
     *
     * @param name hook name, e.g. {@code "proxy-req"} or {@code "preq"}
     * @return the hook, or {@link #INVALID} if the name is not recognized
     */
    public static Hook byName(CharSequence name) {
        if (name == null) {
            return INVALID;
        }
        return BY_NAME.getOrDefault(name.toString().toLowerCase(Locale.ROOT), INVALID);
    }

    /** Looks up a hook by its index, returning {@link #INVALID} when out of range. */
    public static Hook byIndex(int index) {
        Hook[] all = values();
        return index >= 0 && index < all.length ? all[index] : INVALID;
    }

    /** Position of this hook, used to index per-hook tables. */
    public int index() {
        return ordinal();
    }

    /** The primary name, used in diagnostics. */
    public String primaryName() {
        return names.isEmpty() ? "invalid" : names.get(0);
    }

    /** All accepted names, primary first. */
    public List<String> names() {
        return names;
    }

    /**
     * {@code true} if the host dispatches this stage as a per-transaction event, which requires
     * the host integration to subscribe to it.
     */
    public boolean isTransactionHook() {
        return transactionHook;
    }

    @Override
    public String toString() {
        return primaryName();
    }
}
