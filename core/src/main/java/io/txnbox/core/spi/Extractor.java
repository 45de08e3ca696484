package io.txnbox.core.spi;

import io.txnbox.core.config.Config;
import io.txnbox.core.expr.ExtractorSpec;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.Feature;

/**
 * A named producer of a {@link Feature}, referenced from configuration text as {@code name} or
 * {@code name<arg>}. Implementations are registered with
 * {@link io.txnbox.core.registry.ExtractorRegistry} before any configuration is compiled.
 *
 * <p>Implementations MUST be stateless and thread-safe; one instance serves every compiler
 * instance and every request.
 */
public interface Extractor {

    /** Name used in configuration text, without any argument. */
    String name();

    /**
     * Checks a reference to this extractor and reports the type of the value it produces.
     *
     * @param cfg  the compiler instance
     * @param spec the reference being compiled, name already resolved
     * @param arg  the bracketed argument, or {@code null} if there was none
     * @return the result type; flagged {@link ActiveType#isCfgConst() constant} if the value can be
     *     computed now by {@link #extract}
     * @throws io.txnbox.core.error.ConfigException if the reference is not valid
     */
    ActiveType validate(Config cfg, ExtractorSpec spec, CharSequence arg);

    /**
     * Computes the value at configuration load time. Only called if {@link #validate} returned a
     * constant type.
     */
    default Feature extract(Config cfg, ExtractorSpec spec) {
        throw new UnsupportedOperationException("Extractor '" + name() + "' has no load time value");
    }

    /** {@code true} if the value depends on live request context. */
    default boolean hasCtxRef() {
        return false;
    }
}
