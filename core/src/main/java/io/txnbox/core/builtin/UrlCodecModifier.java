package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.error.TypeCheckException;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.registry.ModifierRegistry;
import io.txnbox.core.spi.Modifier;
import java.util.EnumSet;
import java.util.Set;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/** {@code url-encode} and {@code url-decode}: percent-encoding of a string value. */
public final class UrlCodecModifier implements Modifier {

    public static final String ENCODE_KEY = "url-encode";
    public static final String DECODE_KEY = "url-decode";

    private static final Set<ValueType> ACCEPTED = EnumSet.of(ValueType.STRING, ValueType.NIL);

    private final String name;

    private UrlCodecModifier(String name) {
        this.name = name;
    }

    public static void define(ModifierRegistry registry) {
        registry.define(ENCODE_KEY, UrlCodecModifier::load);
        registry.define(DECODE_KEY, UrlCodecModifier::load);
    }

    /**
     * @throws TypeCheckException if the input may be anything other than a string or nil
     */
    static UrlCodecModifier load(
            Config cfg, MappingNode node, String key, CharSequence arg, Node value, ActiveType inputType) {
        if (!inputType.isSubsetOf(ACCEPTED)) {
            throw new TypeCheckException(String.format(
                    "Modifier \"%s\" at %s requires a string value but the value is %s.",
                    key,
                    YamlNodes.mark(node),
                    inputType));
        }
        return new UrlCodecModifier(key);
    }

    public boolean isEncode() {
        return ENCODE_KEY.equals(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ActiveType resultType(ActiveType input) {
        return input.isCfgConst()
                ? ActiveType.of(ValueType.STRING).asCfgConst()
                : ActiveType.of(ValueType.STRING);
    }
}
