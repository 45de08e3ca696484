package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.registry.ModifierRegistry;
import io.txnbox.core.spi.Modifier;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/** {@code else: <expr>} replaces a nil or empty value with the value of another expression. */
public final class ElseModifier implements Modifier {

    public static final String KEY = "else";

    private final Expr alternative;

    private ElseModifier(Expr alternative) {
        this.alternative = alternative;
    }

    public static void define(ModifierRegistry registry) {
        registry.define(KEY, ElseModifier::load);
    }

    static ElseModifier load(
            Config cfg, MappingNode node, String key, CharSequence arg, Node value, ActiveType inputType) {
        return new ElseModifier(cfg.parseExpr(value));
    }

    public Expr alternative() {
        return alternative;
    }

    @Override
    public String name() {
        return KEY;
    }

    @Override
    public boolean hasCtxRef() {
        return alternative.hasCtxRef();
    }

    @Override
    public ActiveType resultType(ActiveType input) {
        ActiveType present = input.without(ValueType.NIL);
        return present.isEmpty() ? alternative.resultType() : present.union(alternative.resultType());
    }
}
