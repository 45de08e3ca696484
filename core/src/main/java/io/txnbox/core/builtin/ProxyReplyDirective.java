package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.Hook;
import io.txnbox.core.model.HookMask;
import io.txnbox.core.registry.DirectiveFactory;
import io.txnbox.core.spi.TypeInitializer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

/**
 * Answers the client without contacting the upstream:
 *
 * <pre>
 * proxy-reply: 404
 * proxy-reply:
 *   status: 503
 *   reason: "Maintenance"
 *   body: "Back at {env&lt;RETURN_TIME&gt;}"
 * </pre>
 */
public final class ProxyReplyDirective extends Directive {

    public static final String KEY = "proxy-reply";
    public static final String STATUS_KEY = "status";
    public static final String REASON_KEY = "reason";
    public static final String BODY_KEY = "body";

    static final HookMask HOOKS = HookMask.of(Hook.CREQ, Hook.PRE_REMAP, Hook.REMAP, Hook.POST_REMAP);

    private final Expr status;
    private final Expr reason;
    private final Expr body;

    private ProxyReplyDirective(Expr status, Expr reason, Expr body) {
        this.status = status;
        this.reason = reason;
        this.body = body;
    }

    public static void define(DirectiveFactory factory) {
        factory.define(KEY, HOOKS, ProxyReplyDirective::load, TypeInitializer.NONE);
    }

    static ProxyReplyDirective load(Config cfg, MappingNode drtvNode, String name, CharSequence arg, Node keyValue) {
        if (keyValue instanceof MappingNode map) {
            Node statusNode = YamlNodes.get(map, STATUS_KEY);
            if (statusNode == null) {
                throw new ConfigStructureException(String.format(
                        "Directive \"%s\" at %s requires a \"%s\" key.", KEY, YamlNodes.mark(keyValue), STATUS_KEY));
            }
            return new ProxyReplyDirective(
                    StatusCodes.parse(cfg, KEY, statusNode),
                    cfg.parseExpr(YamlNodes.get(map, REASON_KEY)),
                    cfg.parseExpr(YamlNodes.get(map, BODY_KEY)));
        }
        return new ProxyReplyDirective(StatusCodes.parse(cfg, KEY, keyValue), Expr.empty(), Expr.empty());
    }

    public Expr status() {
        return status;
    }

    public Expr reason() {
        return reason;
    }

    public Expr body() {
        return body;
    }

    @Override
    public Map<String, Expr> expressions() {
        Map<String, Expr> exprs = new LinkedHashMap<>();
        exprs.put(STATUS_KEY, status);
        exprs.put(REASON_KEY, reason);
        exprs.put(BODY_KEY, body);
        return exprs;
    }
}
