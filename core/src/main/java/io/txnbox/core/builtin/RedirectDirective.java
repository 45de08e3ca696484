package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.Feature;
import io.txnbox.core.registry.DirectiveFactory;
import io.txnbox.core.spi.TypeInitializer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Redirects the client. Three forms are accepted:
 *
 * <pre>
 * redirect: "http://bravo.ex/{ua-req-path}"
 * redirect: [ 301, "http://bravo.ex/{ua-req-path}" ]
 * redirect:
 *   location: "http://charlie.ex/{pre-remap-path}"
 *   status: 302
 *   reason: "Moved"
 *   body: "Now at {ua-req-host}"
 * </pre>
 *
 * The status defaults to 302.
 */
public final class RedirectDirective extends Directive {

    public static final String KEY = "redirect";
    public static final String LOCATION_KEY = "location";

    static final long DEFAULT_STATUS = 302;

    private final Expr location;
    private final Expr status;
    private final Expr reason;
    private final Expr body;

    private RedirectDirective(Expr location, Expr status, Expr reason, Expr body) {
        this.location = location;
        this.status = status;
        this.reason = reason;
        this.body = body;
    }

    public static void define(DirectiveFactory factory) {
        factory.define(KEY, ProxyReplyDirective.HOOKS, RedirectDirective::load, TypeInitializer.NONE);
    }

    static RedirectDirective load(Config cfg, MappingNode drtvNode, String name, CharSequence arg, Node keyValue) {
        if (keyValue instanceof MappingNode map) {
            Node locationNode = YamlNodes.get(map, LOCATION_KEY);
            if (YamlNodes.isNull(locationNode)) {
                throw new ConfigStructureException(String.format(
                        "Directive \"%s\" at %s requires a \"%s\" key.", KEY, YamlNodes.mark(keyValue), LOCATION_KEY));
            }
            Node statusNode = YamlNodes.get(map, ProxyReplyDirective.STATUS_KEY);
            return new RedirectDirective(
                    cfg.parseExpr(locationNode),
                    statusNode == null ? defaultStatus() : StatusCodes.parse(cfg, KEY, statusNode),
                    cfg.parseExpr(YamlNodes.get(map, ProxyReplyDirective.REASON_KEY)),
                    cfg.parseExpr(YamlNodes.get(map, ProxyReplyDirective.BODY_KEY)));
        }

        // [status, location]; a map second element would be a modifier on the location instead.
        if (keyValue instanceof SequenceNode seq
                && seq.getValue().size() == 2
                && !(seq.getValue().get(1) instanceof MappingNode)) {
            List<Node> items = seq.getValue();
            Expr status = StatusCodes.parse(cfg, KEY, items.get(0));
            return new RedirectDirective(cfg.parseExpr(items.get(1)), status, Expr.empty(), Expr.empty());
        }

        if (YamlNodes.isNull(keyValue)) {
            throw new ConfigStructureException(
                    String.format("Directive \"%s\" at %s requires a location.", KEY, YamlNodes.mark(drtvNode)));
        }
        return new RedirectDirective(cfg.parseExpr(keyValue), defaultStatus(), Expr.empty(), Expr.empty());
    }

    private static Expr defaultStatus() {
        return Expr.constant(Feature.of(DEFAULT_STATUS));
    }

    public Expr location() {
        return location;
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
        exprs.put(LOCATION_KEY, location);
        exprs.put(ProxyReplyDirective.STATUS_KEY, status);
        exprs.put(ProxyReplyDirective.REASON_KEY, reason);
        exprs.put(ProxyReplyDirective.BODY_KEY, body);
        return exprs;
    }
}
