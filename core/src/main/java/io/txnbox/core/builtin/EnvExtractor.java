package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.error.ConfigSyntaxException;
import io.txnbox.core.expr.ExtractorSpec;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.Feature;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.spi.Extractor;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@code env<NAME>}: the value of an environment variable, read once when the configuration is
 * compiled. Nil if the variable is not set.
 */
public final class EnvExtractor implements Extractor {

    public static final String NAME = "env";

    private static final ActiveType TYPE = ActiveType.of(ValueType.STRING, ValueType.NIL).asCfgConst();

    private final Function<String, String> envLookup;

    /**
     * @param envLookup environment lookup, normally {@code System::getenv}
     */
    public EnvExtractor(Function<String, String> envLookup) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActiveType validate(Config cfg, ExtractorSpec spec, CharSequence arg) {
        if (arg == null || arg.length() == 0) {
            throw new ConfigSyntaxException(
                    String.format("Extractor \"%s\" requires a variable name argument.", NAME));
        }
        return TYPE;
    }

    @Override
    public Feature extract(Config cfg, ExtractorSpec spec) {
        String value = envLookup.apply(spec.arg().toString());
        return value == null ? Feature.NIL : Feature.text(value);
    }
}
