package io.txnbox.core.spi;

import io.txnbox.core.model.ActiveType;

/**
 * A post-processing step chained onto an expression. Loaded by a {@link ModifierLoader} against
 * the type of the value it receives.
 *
 * <p>Immutable once loaded.
 */
public interface Modifier {

    /** The key this modifier was loaded from. */
    String name();

    /** Type of the value after this modifier is applied to a value of type {@code input}. */
    ActiveType resultType(ActiveType input);

    /** {@code true} if an expression embedded in this modifier reads live request context. */
    default boolean hasCtxRef() {
        return false;
    }
}
