package io.txnbox.core.registry;

import io.txnbox.core.directive.DirectiveType;
import io.txnbox.core.model.HookMask;
import io.txnbox.core.spi.DirectiveLoader;
import io.txnbox.core.spi.TypeInitializer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of directive types, keyed by configuration key. Each type gets the next sequential index
 * when defined. Once sealed, which happens when the first configuration is compiled against the
 * owning {@link Registry}, no more types can be defined and the table is read-only.
 *
 * <p>Thread-safe.
 */
public final class DirectiveFactory {

    private final Map<String, DirectiveType> byName = new ConcurrentHashMap<>();
    private final List<DirectiveType> byIndex = new ArrayList<>();
    private volatile boolean sealed;

    /**
     * Defines a directive type.
     *
     * @param name     configuration key
     * @param hooks    hooks on which the directive may be used
     * @param loader   instance loader
     * @param typeInit one time per-configuration initializer
     * @return the new type
     * @throws IllegalArgumentException if the name is empty or already defined
     * @throws IllegalStateException    if the factory is sealed
     */
    public synchronized DirectiveType define(String name, HookMask hooks, DirectiveLoader loader, TypeInitializer typeInit) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("directive name must not be null or empty");
        }
        if (sealed) {
            throw new IllegalStateException("Cannot define directive '" + name + "' after configurations have been compiled");
        }
        if (byName.containsKey(name)) {
            throw new IllegalArgumentException("Directive '" + name + "' is already defined");
        }
        DirectiveType type = new DirectiveType(name, byIndex.size(), hooks, loader, typeInit);
        byIndex.add(type);
        byName.put(name, type);
        return type;
    }

    /** Looks up a type by key, returning {@code null} if there is none. */
    public DirectiveType find(String name) {
        return byName.get(name);
    }

    /** All types, in index order. */
    public synchronized List<DirectiveType> types() {
        return List.copyOf(byIndex);
    }

    public int size() {
        return byName.size();
    }

    public boolean isSealed() {
        return sealed;
    }

    synchronized void seal() {
        sealed = true;
    }
}
