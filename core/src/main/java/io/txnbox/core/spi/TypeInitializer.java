package io.txnbox.core.spi;

import io.txnbox.core.config.Config;

/**
 * Per-configuration setup for a directive type, run once per compiler instance the first time the
 * type is used there.
 */
@FunctionalInterface
public interface TypeInitializer {

    /** Initializer for types that need no setup. */
    TypeInitializer NONE = cfg -> {};

    void init(Config cfg);
}
