package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.error.TypeCheckException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.Feature;
import io.txnbox.core.model.ValueType;
import java.util.EnumSet;
import org.yaml.snakeyaml.nodes.Node;

/** Compiles and checks HTTP status expressions. */
final class StatusCodes {

    static final int MIN = 100;
    static final int MAX = 599;

    private StatusCodes() {}

    /**
     * Compiles {@code node} as a status. A constant status must be in {@code [100, 599]}.
     *
     * @throws TypeCheckException if the expression cannot produce an integer status
     */
    static Expr parse(Config cfg, String directive, Node node) {
        Expr status = cfg.parseExpr(node);
        if (status.resultType().isEmpty()
                || !status.resultType().isSubsetOf(EnumSet.of(ValueType.INTEGER))) {
            throw new TypeCheckException(String.format(
                    "Status for \"%s\" at %s must be an integer, not %s.",
                    directive,
                    YamlNodes.mark(node),
                    status.resultType()));
        }
        if (status.isLiteral() && status.constantValue() instanceof Feature.IntegerValue code) {
            if (code.value() < MIN || code.value() > MAX) {
                throw new TypeCheckException(String.format(
                        "Status %d for \"%s\" at %s is not in the range %d..%d.",
                        code.value(),
                        directive,
                        YamlNodes.mark(node),
                        MIN,
                        MAX));
            }
        }
        return status;
    }
}
