package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.TypeCheckException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.Hook;
import io.txnbox.core.model.HookMask;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.registry.DirectiveFactory;
import io.txnbox.core.spi.TypeInitializer;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/**
 * Sets a header field of a request or response, e.g.
 * {@code proxy-req-field<X-Origin>: "{ua-req-host}"}. A nil value removes the field; a list sets
 * one field per element.
 */
public final class FieldDirective extends Directive {

    public static final String UA_REQ_KEY = "ua-req-field";
    public static final String PROXY_REQ_KEY = "proxy-req-field";
    public static final String PROXY_RSP_KEY = "proxy-rsp-field";

    private static final Set<ValueType> ACCEPTED =
            EnumSet.of(ValueType.NIL, ValueType.STRING, ValueType.LIST, ValueType.TUPLE);

    private final CharSequence field;
    private final Expr value;

    private FieldDirective(CharSequence field, Expr value) {
        this.field = field;
        this.value = value;
    }

    public static void define(DirectiveFactory factory) {
        factory.define(
                UA_REQ_KEY,
                HookMask.of(Hook.CREQ, Hook.PRE_REMAP, Hook.REMAP, Hook.POST_REMAP),
                FieldDirective::load,
                TypeInitializer.NONE);
        factory.define(PROXY_REQ_KEY, HookMask.of(Hook.PREQ), FieldDirective::load, TypeInitializer.NONE);
        factory.define(PROXY_RSP_KEY, HookMask.of(Hook.PRSP), FieldDirective::load, TypeInitializer.NONE);
    }

    static FieldDirective load(Config cfg, MappingNode drtvNode, String name, CharSequence arg, Node keyValue) {
        if (arg == null || arg.length() == 0) {
            throw new ConfigStructureException(String.format(
                    "Directive \"%s\" at %s requires a field name argument.", name, YamlNodes.mark(drtvNode)));
        }
        Expr value = cfg.parseExpr(keyValue);
        if (!value.resultType().isSubsetOf(ACCEPTED)) {
            throw new TypeCheckException(String.format(
                    "Value for \"%s\" at %s must be a string, a list of strings or nil, not %s.",
                    name,
                    YamlNodes.mark(keyValue),
                    value.resultType()));
        }
        return new FieldDirective(arg, value);
    }

    /** Name of the header field. */
    public CharSequence field() {
        return field;
    }

    public Expr value() {
        return value;
    }

    @Override
    public Map<String, Expr> expressions() {
        return Map.of("value", value);
    }
}
