package io.txnbox.core.config;

import io.txnbox.core.error.ConfigException;
import io.txnbox.core.error.ConfigStructureException;
import io.txnbox.core.error.ConfigSyntaxException;
import io.txnbox.core.error.TypeCheckException;
import io.txnbox.core.error.UnknownNameException;
import io.txnbox.core.expr.Expr;
import io.txnbox.core.expr.ExtractorSpec;
import io.txnbox.core.expr.FormatParser;
import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.BoolNames;
import io.txnbox.core.model.Feature;
import io.txnbox.core.model.IpLiterals;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.spi.Extractor;
import io.txnbox.core.spi.Modifier;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Compiles feature expression nodes into {@link Expr} trees for one {@link Config}.
 *
 * <p>Expression forms:
 * <ul>
 * <li>null or empty sequence: nil
 * <li>{@code !literal} scalar: the text, uninterpreted
 * <li>plain scalar: integer, boolean, address literal or a single extractor reference
 * <li>quoted scalar: composite text with {@code {...}} specifiers
 * <li>{@code [expr, {modifier: ...}, ...]}: an expression with a modifier chain
 * <li>any other sequence: a tuple of expressions
 * </ul>
 */
final class ExprCompiler {

    static final String LITERAL_TAG = "!literal";

    private static final Pattern INTEGER = Pattern.compile("^[-+]?\\d+$");

    private record Resolved(ExtractorSpec spec, ActiveType type) {}

    private final Config cfg;

    ExprCompiler(Config cfg) {
        this.cfg = cfg;
    }

    Expr parseExpr(Node node) {
        if (YamlNodes.isNull(node)) {
            return Expr.constant(Feature.NIL);
        }

        String tag = YamlNodes.explicitTag(node);
        if (tag != null) {
            // A literal is taken verbatim, no extractor syntax.
            if (LITERAL_TAG.equalsIgnoreCase(tag)) {
                if (!(node instanceof ScalarNode scalar)) {
                    throw new ConfigStructureException(String.format(
                            "\"%s\" tag used on value at %s which is not a string as required for a literal.",
                            LITERAL_TAG,
                            YamlNodes.mark(node)));
                }
                return Expr.constant(Feature.literal(cfg.localize(scalar.getValue())));
            }
            if (!"?".equals(tag) && !"!".equals(tag)) {
                throw new UnknownNameException(String.format(
                        "\"%s\" tag for extractor expression at %s is not supported.", tag, YamlNodes.mark(node)));
            }
        }

        if (node instanceof ScalarNode scalar) {
            return parseScalarExpr(scalar);
        }
        if (!(node instanceof SequenceNode seq)) {
            throw new ConfigStructureException(
                    String.format("Feature expression at %s is not properly structured.", YamlNodes.mark(node)));
        }

        List<Node> items = seq.getValue();
        if (items.isEmpty()) {
            return Expr.constant(Feature.NIL);
        }
        if (items.size() == 1) {
            if (items.get(0) instanceof ScalarNode only) {
                return parseScalarExpr(only);
            }
            throw new ConfigStructureException(String.format(
                    "Single element feature expression at %s is not a scalar.", YamlNodes.mark(items.get(0))));
        }
        if (items.get(1) instanceof MappingNode) {
            return parseExprWithMods(seq);
        }

        ActiveType types = ActiveType.none();
        List<Expr> exprs = new ArrayList<>(items.size());
        for (Node child : items) {
            Expr expr;
            try {
                expr = parseExpr(child);
            } catch (ConfigException e) {
                e.addContext("While parsing feature expression list at %s.", YamlNodes.mark(seq));
                throw e;
            }
            types = types.union(expr.resultType());
            exprs.add(expr);
        }
        return Expr.list(exprs, types);
    }

    Expr parseScalarExpr(ScalarNode node) {
        if (YamlNodes.isNull(node)) {
            return Expr.empty();
        }
        String text = node.getValue();
        Expr expr = YamlNodes.isPlain(node) ? parseUnquotedExpr(text) : parseCompositeExpr(text);

        if (expr.maxArgIdx() >= 0) {
            ParseState.Capture capture = cfg.state().capture();
            if (capture.count() == 0) {
                throw new TypeCheckException(String.format(
                        "Regular expression capture group used at %s but no regular expression is active.",
                        YamlNodes.mark(node)));
            }
            if (expr.maxArgIdx() >= capture.count()) {
                throw new TypeCheckException(String.format(
                        "Regular expression capture group %d used at %s but the maximum capture group is %d"
                                + " in the active regular expression from line %d.",
                        expr.maxArgIdx(),
                        YamlNodes.mark(node),
                        capture.count() - 1,
                        capture.line()));
            }
        }

        if (expr.hasCtxRef()) {
            cfg.state().markFeatureRef();
        }
        return expr;
    }

    /** Integer, then boolean, then address literal, then a single extractor reference. */
    Expr parseUnquotedExpr(String text) {
        OptionalLong number = parseInteger(text);
        if (number.isPresent()) {
            return Expr.constant(Feature.of(number.getAsLong()));
        }

        BoolNames.BoolTag b = BoolNames.lookup(text);
        if (b != BoolNames.BoolTag.INVALID) {
            return Expr.constant(Feature.of(b == BoolNames.BoolTag.TRUE));
        }

        Optional<InetAddress> addr = IpLiterals.parse(text);
        if (addr.isPresent()) {
            return Expr.constant(Feature.of(addr.get()));
        }

        Resolved resolved = validate(ExtractorSpec.parse(text));
        if (resolved.type().isCfgConst()) {
            return Expr.constant(extractConstant(resolved.spec()));
        }
        return Expr.direct(resolved.spec(), resolved.type());
    }

    /** Signed decimal within {@code long} range; anything else is not an integer literal. */
    static OptionalLong parseInteger(String text) {
        if (!INTEGER.matcher(text).matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    Expr parseCompositeExpr(String text) {
        List<ExtractorSpec> specs = new ArrayList<>();
        ActiveType singleType = null;

        for (FormatParser.Token token : FormatParser.tokenize(text)) {
            if (!token.literal().isEmpty()) {
                specs.add(ExtractorSpec.literal(cfg.localize(token.literal())));
            }
            ExtractorSpec spec = token.spec();
            if (spec == null) {
                continue;
            }
            if (spec.isCapture()) {
                specs.add(spec.resolve(null, cfg.localize(spec.name()), null, cfg.localize(spec.ext())));
                singleType = ActiveType.of(ValueType.STRING);
                continue;
            }
            Resolved resolved;
            try {
                resolved = validate(spec);
            } catch (ConfigException e) {
                e.addContext("While parsing specifier at offset %d.", token.offset());
                throw e;
            }
            if (resolved.type().isCfgConst()) {
                // Load time values are folded into the text.
                specs.add(ExtractorSpec.literal(cfg.localize(render(extractConstant(resolved.spec())))));
            } else {
                singleType = resolved.type();
                specs.add(resolved.spec());
            }
        }

        if (specs.stream().allMatch(ExtractorSpec::isLiteral)) {
            String joined = specs.stream().map(s -> s.literalText().toString()).collect(Collectors.joining());
            return Expr.constant(Feature.text(specs.size() == 1 ? specs.get(0).literalText() : cfg.localize(joined)));
        }
        if (specs.size() == 1) {
            return Expr.direct(specs.get(0), singleType);
        }
        return Expr.composite(specs);
    }

    private Expr parseExprWithMods(SequenceNode seq) {
        List<Node> items = seq.getValue();
        Expr expr;
        try {
            expr = parseExpr(items.get(0));
        } catch (ConfigException e) {
            e.addContext("While processing the expression at %s.", YamlNodes.mark(seq));
            throw e;
        }

        for (int idx = 1; idx < items.size(); ++idx) {
            Node child = items.get(idx);
            try {
                Modifier mod = cfg.registry().modifiers().load(cfg, child, expr.resultType());
                expr = expr.withModifier(mod);
            } catch (ConfigException e) {
                e.addContext(
                        "While parsing modifier at %s for the feature expression at %s.",
                        YamlNodes.mark(child),
                        YamlNodes.mark(seq));
                throw e;
            }
        }
        return expr;
    }

    /** Resolves a reference against the extractor registry and checks it. */
    private Resolved validate(ExtractorSpec spec) {
        if (spec.name().length() == 0) {
            throw new ConfigSyntaxException("Extractor name required but not found.");
        }
        if (spec.isCapture()) {
            return new Resolved(spec, ActiveType.of(ValueType.STRING));
        }

        YamlNodes.KeyArg key = YamlNodes.parseArg(spec.name().toString());
        Extractor ex = cfg.registry().extractors().find(key.name());
        if (ex == null) {
            throw new UnknownNameException(String.format("Extractor \"%s\" not found.", key.name()));
        }
        ExtractorSpec resolved = spec.resolve(
                ex,
                cfg.localize(key.name()),
                key.arg() == null ? null : cfg.localize(key.arg()),
                cfg.localize(spec.ext()));
        ActiveType type = ex.validate(cfg, resolved, resolved.arg());
        return new Resolved(resolved, type);
    }

    private Feature extractConstant(ExtractorSpec spec) {
        return cfg.localize(spec.extractor().extract(cfg, spec));
    }

    /** Text form of a load time value embedded in composite text. */
    static String render(Feature feature) {
        if (feature instanceof Feature.Text t) {
            return t.text().toString();
        } else if (feature instanceof Feature.IntegerValue i) {
            return Long.toString(i.value());
        } else if (feature instanceof Feature.BooleanValue b) {
            return BoolNames.nameOf(b.value());
        } else if (feature instanceof Feature.IpAddr a) {
            return a.address().getHostAddress();
        } else if (feature instanceof Feature.ListValue l) {
            return l.items().stream().map(ExprCompiler::render).collect(Collectors.joining(","));
        }
        return "";
    }
}
