package io.txnbox.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract base for all configuration compile failures. Never thrown directly; use the concrete
 * subclass for the failure {@link Category}.
 *
 * <p>As the failure propagates, each layer of the compiler appends a context frame with
 * {@link #addContext(String, Object...)}. {@link #getMessage()} renders the original detail
 * followed by the frames, innermost first.
 */
public abstract class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Kind of defect in the configuration. */
    public enum Category {
        /** Wrong YAML node shape where a specific shape is required. */
        STRUCTURE,
        /** Unknown directive, extractor, modifier, hook or key. */
        LOOKUP,
        /** Capture index out of range or incompatible value types. */
        TYPE,
        /** Directive used on a disallowed hook. */
        POLICY,
        /** Malformed argument brackets, format specifiers or patterns. */
        SYNTAX,
        /** Several independent failures reported together. */
        AGGREGATE
    }

    private final Category category;
    private final List<String> context = new ArrayList<>();

    protected ConfigException(String message, Category category) {
        super(message);
        this.category = category;
    }

    protected ConfigException(String message, Throwable cause, Category category) {
        super(message, cause);
        this.category = category;
    }

    /**
     * Appends a context frame and returns this exception so it can be rethrown in one statement.
     *
     * @param format {@link String#format} pattern
     * @param args   pattern arguments
     * @return this exception
     */
    public ConfigException addContext(String format, Object... args) {
        context.add(args.length == 0 ? format : String.format(format, args));
        return this;
    }

    /** The category of the underlying defect. */
    public Category category() {
        return category;
    }

    /** The failure detail without context frames. */
    public String detail() {
        return super.getMessage();
    }

    /** Context frames, innermost first. */
    public List<String> context() {
        return Collections.unmodifiableList(context);
    }

    @Override
    public String getMessage() {
        if (context.isEmpty()) {
            return detail();
        }
        StringBuilder sb = new StringBuilder(detail());
        for (String frame : context) {
            sb.append(System.lineSeparator()).append("  ").append(frame);
        }
        return sb.toString();
    }
}
