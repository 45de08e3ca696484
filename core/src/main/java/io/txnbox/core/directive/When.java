package io.txnbox.core.directive;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.ParseState;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.UnknownNameException;
import io.txnbox.core.model.Hook;
import io.txnbox.core.model.HookMask;
import io.txnbox.core.registry.DirectiveFactory;
import io.txnbox.core.spi.TypeInitializer;
import java.util.List;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;

/**
 * Pairs a hook with the directive(s) to run there:
 *
 * <pre>
 * when: proxy-req
 * do:
 * - proxy-req-field&lt;X-Origin&gt;: "{ua-req-host}"
 * </pre>
 *
 * The body is compiled with the active hook set to the target hook, so directives that are not
 * legal there are rejected.
 */
public final class When extends Directive {

    public static final String KEY = "when";

    /** Key holding the body of a directive; ignored when looking for the directive's type. */
    public static final String DO_KEY = "do";

    private final Hook hook;
    private final Directive directive;

    private When(Hook hook, Directive directive) {
        this.hook = hook;
        this.directive = directive;
    }

    /** Registers this type. Every registry has it. */
    public static void define(DirectiveFactory factory) {
        factory.define(KEY, HookMask.all(), When::load, TypeInitializer.NONE);
    }

    /**
     * Loads a {@code when} directive.
     *
     * @throws ConfigStructureException if the hook value is not a scalar
     * @throws UnknownNameException     if the hook name is not recognized
     */
    public static When load(Config cfg, MappingNode drtvNode, String name, CharSequence arg, Node keyValue) {
        if (!(keyValue instanceof ScalarNode hookNode) || YamlNodes.isNull(keyValue)) {
            throw new ConfigStructureException(String.format(
                    "Value for \"%s\" at %s must be a hook name.", KEY, YamlNodes.mark(drtvNode)));
        }
        Hook hook = Hook.byName(hookNode.getValue());
        if (hook == Hook.INVALID) {
            throw new UnknownNameException(String.format(
                    "Invalid hook name \"%s\" in \"%s\" directive at %s.", hookNode.getValue(), KEY, YamlNodes.mark(keyValue)));
        }
        Directive body;
        try (ParseState.Scope scope = cfg.state().withHook(hook)) {
            body = cfg.parseDirective(YamlNodes.get(drtvNode, DO_KEY));
        }
        return new When(hook, body);
    }

    /** The hook the body runs on. */
    public Hook hook() {
        return hook;
    }

    /** The body. */
    public Directive directive() {
        return directive;
    }

    @Override
    public List<Directive> children() {
        return List.of(directive);
    }
}
