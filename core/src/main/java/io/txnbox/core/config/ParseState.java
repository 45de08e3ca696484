package io.txnbox.core.config;

import io.txnbox.core.directive.CfgInfo;
import io.txnbox.core.model.Hook;
import java.util.Objects;

/**
 * Mutable context of one compile pass: the active hook, the capture groups provided by the most
 * recently compiled regular expression, the innermost feature scope and the directive type being
 * loaded. Every setter returns a {@link Scope} that restores the previous value, so nested
 * directives use try-with-resources:
 *
 * <pre>
 * try (ParseState.Scope scope = cfg.state().withCapture(groups, line)) {
 *     body = cfg.parseDirective(doNode);
 * }
 * </pre>
 *
 * <p>Not thread-safe. Owned by a single {@link Config}.
 */
public final class ParseState {

    /** Restores the previous value on close. */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Capture groups available to expressions.
     *
     * @param count number of groups, including group 0; 0 if no expression is active
     * @param line  line of the regular expression that provides them
     */
    public record Capture(int count, int line) {
        public static final Capture NONE = new Capture(0, 0);
    }

    /** Records whether any expression compiled inside it references live request context. */
    public final class FeatureScope implements Scope {
        private final FeatureScope outer;
        private boolean referenced;

        private FeatureScope(FeatureScope outer) {
            this.outer = outer;
        }

        public boolean referenced() {
            return referenced;
        }

        @Override
        public void close() {
            feature = outer;
        }
    }

    private Hook hook = Hook.INVALID;
    private Capture capture = Capture.NONE;
    private FeatureScope feature;
    private CfgInfo directive;

    public Hook hook() {
        return hook;
    }

    public Scope withHook(Hook value) {
        Hook saved = hook;
        hook = Objects.requireNonNull(value, "hook must not be null");
        return () -> hook = saved;
    }

    public Capture capture() {
        return capture;
    }

    /**
     * Makes {@code count} capture groups available.
     *
     * @param count groups including group 0
     * @param line  line of the providing expression
     */
    public Scope withCapture(int count, int line) {
        if (count < 0) {
            throw new IllegalArgumentException("capture count must not be negative, got: " + count);
        }
        Capture saved = capture;
        capture = new Capture(count, line);
        return () -> capture = saved;
    }

    /** Opens a feature scope; close it to restore the enclosing one. */
    public FeatureScope featureScope() {
        feature = new FeatureScope(feature);
        return feature;
    }

    /** Marks the innermost feature scope, if any, as referencing request context. */
    void markFeatureRef() {
        if (feature != null) {
            feature.referenced = true;
        }
    }

    /** Runtime record of the directive type currently being loaded, or {@code null}. */
    public CfgInfo activeDirective() {
        return directive;
    }

    Scope withDirective(CfgInfo info) {
        CfgInfo saved = directive;
        directive = info;
        return () -> directive = saved;
    }
}
