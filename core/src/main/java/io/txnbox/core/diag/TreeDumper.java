package io.txnbox.core.diag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.txnbox.core.config.Config;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.Hook;
import java.util.Map;

/**
 * Renders a compiled {@link Config} as JSON for diagnostics:
 *
 * <pre>
 * {
 *   "hasTopLevelDirective" : true,
 *   "hooks" : {
 *     "proxy-req" : [ { "directive" : "proxy-req-field", "uses" : 1,
 *                       "expressions" : { "value" : { "shape" : "extractor{ua-req-host}", "type" : "string" } } } ]
 *   }
 * }
 * </pre>
 */
public final class TreeDumper {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private TreeDumper() {
        // utility class
    }

    /** The tree of {@code cfg} as a JSON object. */
    public static ObjectNode toJson(Config cfg) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("hasTopLevelDirective", cfg.hasTopLevelDirective());
        ObjectNode hooks = root.putObject("hooks");
        for (Hook hook : cfg.hooks()) {
            ArrayNode list = hooks.putArray(hook.primaryName());
            for (Directive directive : cfg.roots(hook)) {
                list.add(directive(directive));
            }
        }
        return root;
    }

    /** The tree of {@code cfg} as indented JSON text. */
    public static String dump(Config cfg) {
        try {
            return MAPPER.writeValueAsString(toJson(cfg));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render configuration tree", e);
        }
    }

    private static ObjectNode directive(Directive directive) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("directive", directive.typeName());
        if (directive.info() != null) {
            node.put("uses", directive.info().count());
        }
        Map<String, Expr> exprs = directive.expressions();
        if (!exprs.isEmpty()) {
            ObjectNode exprNode = node.putObject("expressions");
            exprs.forEach((key, expr) -> exprNode.set(key, expr(expr)));
        }
        if (!directive.children().isEmpty()) {
            ArrayNode children = node.putArray("children");
            for (Directive child : directive.children()) {
                children.add(directive(child));
            }
        }
        return node;
    }

    private static ObjectNode expr(Expr expr) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("shape", expr.describe());
        node.put("type", expr.resultType().toString());
        if (expr.maxArgIdx() >= 0) {
            node.put("maxCapture", expr.maxArgIdx());
        }
        if (expr.hasCtxRef()) {
            node.put("contextRef", true);
        }
        return node;
    }
}
