package io.txnbox.core.registry;

import io.txnbox.core.directive.When;

/**
 * Everything a compiler instance resolves names against: directive types, extractors and
 * modifiers. Built once at startup by an explicit sequence of registration calls, then sealed by
 * the first {@link io.txnbox.core.config.Config} created from it. After sealing it is read-only
 * and may be shared by concurrently compiling configurations.
 */
public final class Registry {

    private final DirectiveFactory directives = new DirectiveFactory();
    private final ExtractorRegistry extractors = new ExtractorRegistry();
    private final ModifierRegistry modifiers = new ModifierRegistry();

    private Registry() {}

    /** A registry holding only the core {@code when} directive. */
    public static Registry create() {
        Registry registry = new Registry();
        When.define(registry.directives);
        return registry;
    }

    public DirectiveFactory directives() {
        return directives;
    }

    public ExtractorRegistry extractors() {
        return extractors;
    }

    public ModifierRegistry modifiers() {
        return modifiers;
    }

    /** Forbids further registration. Idempotent. */
    public void seal() {
        directives.seal();
        extractors.seal();
        modifiers.seal();
    }

    public boolean isSealed() {
        return directives.isSealed();
    }
}
