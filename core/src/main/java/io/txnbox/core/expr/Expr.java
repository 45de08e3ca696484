package io.txnbox.core.expr;

import io.txnbox.core.model.ActiveType;
import io.txnbox.core.model.Feature;
import io.txnbox.core.model.ValueType;
import io.txnbox.core.spi.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A compiled feature expression: one {@link Term} plus its static result type, the highest
 * regular expression capture group it references, whether it references live request context,
 * and the modifiers applied to its value in order.
 *
 * <p>Immutable and thread-safe once built. Owned by the directive that embeds it.
 */
public final class Expr {

    /** The shape of an expression. The set of variants is closed. */
    public sealed interface Term permits Empty, Constant, Direct, Composite, ListOf {}

    /** No value at all. */
    public record Empty() implements Term {}

    /** A value computed at load time and embedded in the tree. */
    public record Constant(Feature value) implements Term {
        public Constant {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** A single extractor or capture group reference, resolved per request. */
    public record Direct(ExtractorSpec spec) implements Term {
        public Direct {
            Objects.requireNonNull(spec, "spec must not be null");
        }
    }

    /** Literal runs interleaved with references, producing a string. */
    public record Composite(List<ExtractorSpec> specs) implements Term {
        public Composite {
            specs = List.copyOf(specs);
        }
    }

    /** A tuple of sub-expressions. */
    public record ListOf(List<Expr> exprs) implements Term {
        public ListOf {
            exprs = List.copyOf(exprs);
        }
    }

    private static final Expr EMPTY =
            new Expr(new Empty(), ActiveType.of(ValueType.NIL).asCfgConst(), -1, false, List.of());

    private final Term term;
    private final ActiveType resultType;
    private final int maxArgIdx;
    private final boolean ctxRef;
    private final List<Modifier> mods;

    private Expr(Term term, ActiveType resultType, int maxArgIdx, boolean ctxRef, List<Modifier> mods) {
        this.term = term;
        this.resultType = resultType;
        this.maxArgIdx = maxArgIdx;
        this.ctxRef = ctxRef;
        this.mods = List.copyOf(mods);
    }

    public static Expr empty() {
        return EMPTY;
    }

    public static Expr constant(Feature value) {
        return new Expr(new Constant(value), value.activeType(), -1, false, List.of());
    }

    /**
     * @param spec a resolved extractor reference or a capture group reference
     * @param type the validated result type
     */
    public static Expr direct(ExtractorSpec spec, ActiveType type) {
        if (spec.isLiteral()) {
            throw new IllegalArgumentException("a literal run is not a reference: " + spec);
        }
        boolean ref = spec.extractor() != null && spec.extractor().hasCtxRef();
        return new Expr(new Direct(spec), type.asRuntime(), spec.index(), ref, List.of());
    }

    /** A composite string; the capture index and context flag are aggregated from {@code specs}. */
    public static Expr composite(List<ExtractorSpec> specs) {
        int maxIdx = -1;
        boolean ref = false;
        for (ExtractorSpec s : specs) {
            maxIdx = Math.max(maxIdx, s.index());
            if (s.extractor() != null) {
                ref = ref || s.extractor().hasCtxRef();
            }
        }
        return new Expr(new Composite(specs), ActiveType.of(ValueType.STRING), maxIdx, ref, List.of());
    }

    /**
     * A tuple.
     *
     * @param exprs        the elements
     * @param elementTypes union of the element types
     */
    public static Expr list(List<Expr> exprs, ActiveType elementTypes) {
        int maxIdx = -1;
        boolean ref = false;
        boolean allConst = true;
        for (Expr e : exprs) {
            maxIdx = Math.max(maxIdx, e.maxArgIdx);
            ref = ref || e.ctxRef;
            allConst = allConst && e.resultType.isCfgConst();
        }
        ActiveType type = ActiveType.tupleOf(elementTypes);
        return new Expr(new ListOf(exprs), allConst ? type.asCfgConst() : type, maxIdx, ref, List.of());
    }

    /**
     * Copy of this expression with {@code mod} appended; the result type becomes the modifier's and
     * the context flag includes any the modifier's own expressions carry.
     */
    public Expr withModifier(Modifier mod) {
        List<Modifier> chain = new ArrayList<>(mods);
        chain.add(mod);
        return new Expr(term, mod.resultType(resultType), maxArgIdx, ctxRef || mod.hasCtxRef(), chain);
    }

    public Term term() {
        return term;
    }

    public ActiveType resultType() {
        return resultType;
    }

    /** Highest capture group referenced, {@code -1} if none. */
    public int maxArgIdx() {
        return maxArgIdx;
    }

    /** {@code true} if evaluating this expression reads live request context. */
    public boolean hasCtxRef() {
        return ctxRef;
    }

    public List<Modifier> mods() {
        return mods;
    }

    public boolean isEmpty() {
        return term instanceof Empty;
    }

    /** {@code true} for an embedded constant with no modifiers. */
    public boolean isLiteral() {
        return term instanceof Constant && mods.isEmpty();
    }

    /** The embedded value of a {@link Constant} term. */
    public Feature constantValue() {
        if (term instanceof Constant c) {
            return c.value();
        }
        throw new IllegalStateException("not a constant expression: " + this);
    }

    /** Short rendering for diagnostics, e.g. {@code composite["a", {ua-req-path}]}. */
    public String describe() {
        String base;
        if (term instanceof Empty) {
            base = "empty";
        } else if (term instanceof Constant c) {
            base = "constant(" + describe(c.value()) + ")";
        } else if (term instanceof Direct d) {
            base = "extractor" + d.spec();
        } else if (term instanceof Composite c) {
            base = c.specs().stream().map(ExtractorSpec::toString).collect(Collectors.joining(", ", "composite[", "]"));
        } else {
            base = ((ListOf) term).exprs().stream().map(Expr::describe).collect(Collectors.joining(", ", "list[", "]"));
        }
        if (mods.isEmpty()) {
            return base;
        }
        return base + mods.stream().map(Modifier::name).collect(Collectors.joining(" | ", " | ", ""));
    }

    private static String describe(Feature feature) {
        if (feature instanceof Feature.Text t) {
            return "\"" + t.text() + "\"";
        } else if (feature instanceof Feature.IntegerValue i) {
            return Long.toString(i.value());
        } else if (feature instanceof Feature.BooleanValue b) {
            return Boolean.toString(b.value());
        } else if (feature instanceof Feature.IpAddr a) {
            return a.address().getHostAddress();
        } else if (feature instanceof Feature.ListValue l) {
            return l.items().stream().map(Expr::describe).collect(Collectors.joining(", ", "[", "]"));
        }
        return "nil";
    }

    @Override
    public String toString() {
        return describe() + " : " + resultType;
    }
}
