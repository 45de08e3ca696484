package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.error.TypeCheckException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.registry.ModifierRegistry;
import io.txnbox.core.spi.Modifier;
import java.util.EnumSet;
import java.util.Set;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/**
 * {@code as-integer: <default>} converts a string to an integer. The optional default is used when
 * the conversion fails; without one the result is nil in that case.
 */
public final class AsIntegerModifier implements Modifier {

    public static final String KEY = "as-integer";

    private static final Set<ValueType> ACCEPTED = EnumSet.of(ValueType.STRING, ValueType.INTEGER, ValueType.NIL);

    private final Expr fallback;

    private AsIntegerModifier(Expr fallback) {
        this.fallback = fallback;
    }

    public static void define(ModifierRegistry registry) {
        registry.define(KEY, AsIntegerModifier::load);
    }

    static AsIntegerModifier load(
            Config cfg, MappingNode node, String key, CharSequence arg, Node value, ActiveType inputType) {
        if (!inputType.isSubsetOf(ACCEPTED)) {
            throw new TypeCheckException(String.format(
                    "Modifier \"%s\" at %s cannot convert a value of type %s.", KEY, YamlNodes.mark(node), inputType));
        }
        Expr fallback = cfg.parseExpr(value);
        ActiveType fallbackType = fallback.resultType();
        if (!fallbackType.isSubsetOf(EnumSet.of(ValueType.INTEGER, ValueType.NIL))) {
            throw new TypeCheckException(String.format(
                    "Default for \"%s\" at %s must be an integer, not %s.", KEY, YamlNodes.mark(value), fallbackType));
        }
        return new AsIntegerModifier(fallback);
    }

    public Expr fallback() {
        return fallback;
    }

    @Override
    public String name() {
        return KEY;
    }

    @Override
    public boolean hasCtxRef() {
        return fallback.hasCtxRef();
    }

    @Override
    public ActiveType resultType(ActiveType input) {
        ActiveType result = ActiveType.of(ValueType.INTEGER);
        if (fallback.resultType().canBe(ValueType.NIL)) {
            result = result.union(ActiveType.of(ValueType.NIL));
        }
        return result;
    }
}
