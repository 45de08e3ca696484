package io.txnbox.core.testkit;

import io.txnbox.core.builtin.Builtins;
import io.txnbox.core.config.Config;
import io.txnbox.core.config.ParseState;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.Feature;
import io.txnbox.core.model.Hook;
import io.txnbox.core.registry.Registry;
import java.util.Map;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/** Shared helpers for compiler tests. */
public final class Fixtures {

    /** Environment seen by {@code env<NAME>} in tests. */
    public static final Map<String, String> ENV = Map.of("HOME_HOST", "home.ex", "EMPTY", "");

    private Fixtures() {}

    /** A registry with the built-ins, reading {@link #ENV}. Not yet sealed. */
    public static Registry registry() {
        return Builtins.install(Registry.create(), ENV::get);
    }

    public static Node yaml(String text) {
        return YamlNodes.compose(text);
    }

    public static MappingNode map(String text) {
        return (MappingNode) YamlNodes.compose(text);
    }

    /** Compiles {@code text} as a directive node with {@code hook} active. */
    public static Directive directive(Config cfg, Hook hook, String text) {
        try (ParseState.Scope scope = cfg.state().withHook(hook)) {
            return cfg.parseDirective(yaml(text));
        }
    }

    /** Text of a constant string expression. */
    public static String text(Expr expr) {
        return ((Feature.Text) expr.constantValue()).text().toString();
    }
}
