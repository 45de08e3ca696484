package io.txnbox.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Set of hooks on which a directive type may be used, stored as one bit per {@link Hook} index.
 * Immutable.
 */
public final class HookMask {

    private static final HookMask NONE = new HookMask(0L);

    private final long bits;

    private HookMask(long bits) {
        this.bits = bits;
    }

    public static HookMask none() {
        return NONE;
    }

    public static HookMask of(Hook... hooks) {
        long bits = 0L;
        for (Hook hook : hooks) {
            if (hook == Hook.INVALID) {
                throw new IllegalArgumentException("INVALID is not a hook");
            }
            bits |= 1L << hook.index();
        }
        return new HookMask(bits);
    }

    /** Every real hook. */
    public static HookMask all() {
        long bits = 0L;
        for (Hook hook : Hook.values()) {
            if (hook != Hook.INVALID) {
                bits |= 1L << hook.index();
            }
        }
        return new HookMask(bits);
    }

    /** Every hook that runs within a transaction, plus {@link Hook#REMAP}. */
    public static HookMask transaction() {
        long bits = 0L;
        for (Hook hook : Hook.values()) {
            if (hook.isTransactionHook() || hook == Hook.REMAP) {
                bits |= 1L << hook.index();
            }
        }
        return new HookMask(bits);
    }

    public boolean allows(Hook hook) {
        return hook != Hook.INVALID && (bits & (1L << hook.index())) != 0;
    }

    public HookMask with(Hook hook) {
        return new HookMask(bits | (1L << hook.index()));
    }

    public List<Hook> hooks() {
        List<Hook> hooks = new ArrayList<>();
        for (Hook hook : Hook.values()) {
            if (allows(hook)) {
                hooks.add(hook);
            }
        }
        return hooks;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HookMask that && bits == that.bits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return hooks().toString();
    }
}
