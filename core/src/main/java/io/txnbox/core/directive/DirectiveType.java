package io.txnbox.core.directive;

import io.txnbox.core.model.HookMask;
import io.txnbox.core.spi.DirectiveLoader;
import io.txnbox.core.spi.TypeInitializer;
import java.util.Objects;

/**
 * Process wide description of a directive type, created by
 * {@link io.txnbox.core.registry.DirectiveFactory#define}.
 *
 * @param name     configuration key of the directive
 * @param index    position in the factory, used to address per-configuration records
 * @param hooks    hooks on which the directive may be used
 * @param loader   instance loader
 * @param typeInit one time per-configuration initializer
 */
public record DirectiveType(String name, int index, HookMask hooks, DirectiveLoader loader, TypeInitializer typeInit) {

    public DirectiveType {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(hooks, "hooks must not be null");
        Objects.requireNonNull(loader, "loader must not be null");
        Objects.requireNonNull(typeInit, "typeInit must not be null");
    }
}
