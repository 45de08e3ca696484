package io.txnbox.core.directive;

import io.txnbox.core.expr.Expr;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled directive instance. Subclasses hold whatever their loader produced, typically
 * {@link Expr}s and child directives. Every instance built from a registered type is bound to the
 * per-configuration {@link CfgInfo} of that type.
 *
 * <p>Instances are not modified after the compile pass and may be read concurrently.
 */
public abstract class Directive {

    private CfgInfo info;

    /**
     * Binds this instance to its type's runtime record. Called once by the compiler after the
     * type's loader returns.
     *
     * @throws IllegalStateException if already bound
     */
    public final void bind(CfgInfo cfgInfo) {
        if (this.info != null) {
            throw new IllegalStateException("directive already bound to " + this.info.type().name());
        }
        this.info = Objects.requireNonNull(cfgInfo, "cfgInfo must not be null");
    }

    /** The runtime record of this directive's type, or {@code null} for structural directives. */
    public final CfgInfo info() {
        return info;
    }

    /** Name used in diagnostics. */
    public String typeName() {
        return info != null ? info.type().name() : getClass().getSimpleName();
    }

    /** Nested directives, in execution order. */
    public List<Directive> children() {
        return List.of();
    }

    /** Expressions embedded in this directive, keyed by the configuration key they came from. */
    public Map<String, Expr> expressions() {
        return Map.of();
    }
}
