package io.txnbox.core.builtin;

import io.txnbox.core.config.Config;
import io.txnbox.core.config.ParseState;
import io.txnbox.core.config.YamlNodes;
import io.txnbox.core.directive.CfgInfo;
import io.txnbox.core.directive.Directive;
import io.txnbox.core.directive.NilDirective;
import io.txnbox.core.directive.When;
import io.txnbox.core.error.ConfigException;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.ConfigSyntaxException;
import io.txnbox.core.error.TypeCheckException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.model.HookMask;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.registry.DirectiveFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Compares a feature against a list of cases and runs the body of the first case that matches:
 *
 * <pre>
 * with: ua-req-path
 * select:
 * - prefix: "api/"
 *   do: ...
 * - rxp: "^v(\\d+)/(.*)$"
 *   do:
 *   - proxy-req-field&lt;X-Version&gt;: "{1}"
 * - do: ...   # no comparison, always matches
 * </pre>
 *
 * A regular expression case makes its capture groups available to expressions in its body. The
 * other comparisons make group 0, the whole feature, available.
 */
public final class WithDirective extends Directive {

    public static final String KEY = "with";
    public static final String SELECT_KEY = "select";

    /** Argument that makes a comparison ignore case, e.g. {@code prefix<nc>}. */
    public static final String NO_CASE_ARG = "nc";

    /** Kinds of comparison a case can make. */
    public enum Comparison {
        ALWAYS(""),
        MATCH("match"),
        PREFIX("prefix"),
        SUFFIX("suffix"),
        RXP("rxp");

        private final String key;

        Comparison(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        static Comparison byKey(String key) {
            for (Comparison c : values()) {
                if (c != ALWAYS && c.key.equals(key)) {
                    return c;
                }
            }
            return null;
        }
    }

    /**
     * One case of a {@code select}.
     *
     * @param comparison what to compare
     * @param operand    text compared against, empty for {@link Comparison#ALWAYS}
     * @param noCase     {@code true} to ignore case
     * @param pattern    the compiled expression for {@link Comparison#RXP}, else {@code null}
     * @param body       directive run when the case matches
     */
    public record Case(Comparison comparison, CharSequence operand, boolean noCase, Pattern pattern, Directive body) {}

    private final Expr feature;
    private final boolean ctxRef;
    private final List<Case> cases;

    private WithDirective(Expr feature, boolean ctxRef, List<Case> cases) {
        this.feature = feature;
        this.ctxRef = ctxRef;
        this.cases = List.copyOf(cases);
    }

    public static void define(DirectiveFactory factory) {
        factory.define(KEY, HookMask.transaction(), WithDirective::load, WithDirective::typeInit);
    }

    /** Gives each configuration its own pattern cache, cleared when the configuration closes. */
    static void typeInit(Config cfg) {
        PatternCache cache = new PatternCache();
        cfg.state().activeDirective().setState(cache);
        cfg.addFinalizer(cache::clear);
    }

    static WithDirective load(Config cfg, MappingNode drtvNode, String name, CharSequence arg, Node keyValue) {
        Expr feature;
        boolean ctxRef;
        try (ParseState.FeatureScope scope = cfg.state().featureScope()) {
            feature = cfg.parseExpr(keyValue);
            ctxRef = scope.referenced();
        }

        Node selectNode = YamlNodes.get(drtvNode, SELECT_KEY);
        if (selectNode == null) {
            throw new ConfigStructureException(String.format(
                    "Directive \"%s\" at %s requires a \"%s\" key.", KEY, YamlNodes.mark(drtvNode), SELECT_KEY));
        }
        List<Node> caseNodes;
        if (selectNode instanceof SequenceNode seq) {
            caseNodes = seq.getValue();
        } else if (selectNode instanceof MappingNode) {
            caseNodes = List.of(selectNode);
        } else {
            throw new ConfigStructureException(String.format(
                    "\"%s\" at %s must be a case object or a list of them.", SELECT_KEY, YamlNodes.mark(selectNode)));
        }

        CfgInfo info = cfg.state().activeDirective();
        PatternCache patterns = info.state(PatternCache.class);
        List<Case> cases = new ArrayList<>(caseNodes.size());
        for (Node caseNode : caseNodes) {
            try {
                cases.add(loadCase(cfg, patterns, feature, caseNode));
            } catch (ConfigException e) {
                e.addContext("While parsing case at %s in \"%s\" at %s.", YamlNodes.mark(caseNode), KEY, YamlNodes.mark(drtvNode));
                throw e;
            }
        }
        return new WithDirective(feature, ctxRef, cases);
    }

    private static Case loadCase(Config cfg, PatternCache patterns, Expr feature, Node caseNode) {
        if (!(caseNode instanceof MappingNode map)) {
            throw new ConfigStructureException(
                    String.format("Case at %s is not an object as required.", YamlNodes.mark(caseNode)));
        }

        Comparison comparison = Comparison.ALWAYS;
        boolean noCase = false;
        Node operandNode = null;
        for (NodeTuple entry : map.getValue()) {
            if (!(entry.getKeyNode() instanceof ScalarNode keyNode)) {
                continue;
            }
            YamlNodes.KeyArg key = YamlNodes.parseArg(keyNode.getValue());
            Comparison c = Comparison.byKey(key.name());
            if (c == null) {
                continue;
            }
            if (comparison != Comparison.ALWAYS) {
                throw new ConfigStructureException(String.format(
                        "Case at %s has more than one comparison.", YamlNodes.mark(caseNode)));
            }
            if (key.arg() != null && !NO_CASE_ARG.equalsIgnoreCase(key.arg())) {
                throw new ConfigSyntaxException(
                        String.format("Argument \"%s\" for \"%s\" is not supported.", key.arg(), key.name()));
            }
            comparison = c;
            noCase = key.arg() != null;
            operandNode = entry.getValueNode();
        }

        Node doNode = YamlNodes.get(map, When.DO_KEY);
        if (comparison == Comparison.ALWAYS) {
            if (doNode == null) {
                throw new ConfigStructureException(String.format(
                        "Case at %s has no comparison and no \"%s\" key.", YamlNodes.mark(caseNode), When.DO_KEY));
            }
            return new Case(comparison, "", false, null, loadBody(cfg, doNode, 1, YamlNodes.line(caseNode)));
        }

        if (!feature.resultType().canBe(ValueType.STRING)) {
            throw new TypeCheckException(String.format(
                    "Comparison \"%s\" at %s requires a string feature but the feature is %s.",
                    comparison.key(),
                    YamlNodes.mark(caseNode),
                    feature.resultType()));
        }
        String operand = YamlNodes.text(operandNode);
        if (operand == null) {
            throw new ConfigStructureException(String.format(
                    "Value for \"%s\" at %s must be a string.", comparison.key(), YamlNodes.mark(caseNode)));
        }

        Pattern pattern = null;
        int groups = 1;
        if (comparison == Comparison.RXP) {
            pattern = patterns.compile(operand, noCase ? Pattern.CASE_INSENSITIVE : 0);
            groups = pattern.matcher("").groupCount() + 1;
        }
        Directive body = loadBody(cfg, doNode, groups, YamlNodes.line(operandNode));
        return new Case(comparison, cfg.localize(operand), noCase, pattern, body);
    }

    private static Directive loadBody(Config cfg, Node doNode, int groups, int line) {
        if (doNode == null) {
            return new NilDirective();
        }
        try (ParseState.Scope scope = cfg.state().withCapture(groups, line)) {
            return cfg.parseDirective(doNode);
        }
    }

    public Expr feature() {
        return feature;
    }

    /** {@code true} if the compared feature depends on request context. */
    public boolean hasCtxRef() {
        return ctxRef;
    }

    public List<Case> cases() {
        return cases;
    }

    @Override
    public List<Directive> children() {
        return cases.stream().map(Case::body).toList();
    }

    @Override
    public Map<String, Expr> expressions() {
        return Map.of(KEY, feature);
    }
}
