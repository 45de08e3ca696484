package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.error.ConfigSyntaxException;
import io.txnbox.core.expr.ExtractorSpec;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.spi.Extractor;
import java.util.Objects;

/**
 * Extractor for a value of the transaction being processed, such as the client request path or
 * a header of the proxy response. Its value only exists at request time, so it always reports a
 * runtime type and references request context.
 */
public final class ContextExtractor implements Extractor {

    private final String name;
    private final ActiveType type;
    private final boolean argRequired;

    private ContextExtractor(String name, ActiveType type, boolean argRequired) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type.asRuntime();
        this.argRequired = argRequired;
    }

    /** An extractor that takes no argument. */
    public static ContextExtractor plain(String name, ActiveType type) {
        return new ContextExtractor(name, type, false);
    }

    /** An extractor that requires an argument, e.g. {@code ua-req-field<Host>}. */
    public static ContextExtractor withArg(String name, ActiveType type) {
        return new ContextExtractor(name, type, true);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ActiveType validate(Config cfg, ExtractorSpec spec, CharSequence arg) {
        if (argRequired && (arg == null || arg.length() == 0)) {
            throw new ConfigSyntaxException(String.format("Extractor \"%s\" requires an argument.", name));
        }
        if (!argRequired && arg != null) {
            throw new ConfigSyntaxException(String.format("Extractor \"%s\" does not take an argument.", name));
        }
        return type;
    }

    @Override
    public boolean hasCtxRef() {
        return true;
    }

    public boolean isArgRequired() {
        return argRequired;
    }

    @Override
    public String toString() {
        return "ContextExtractor[" + name + " : " + type + "]";
    }
}
