package io.txnbox.core.expr;

import io.txnbox.core.error.ConfigSyntaxException;
import io.txnbox.core.spi.Extractor;
import java.util.Objects;

/**
 * One element of expression text: either a run of literal text or a reference to an extractor
 * ({@code name<arg>:format:extension}). A reference whose name is a non-negative integer refers to
 * a regular expression capture group; its {@link #index()} is that group.
 *
 * <p>Immutable. A reference is created unresolved while parsing and replaced by a resolved copy
 * once validated.
 *
 * @param kind      literal text or extractor reference
 * @param name      extractor name, argument stripped once resolved; empty for literals
 * @param arg       the bracketed argument, or {@code null}
 * @param format    format text after the first {@code ':'}, possibly empty
 * @param ext       extension text after the second {@code ':'}; the text itself for literals
 * @param index     capture group, or {@code -1} for a named extractor or a literal
 * @param extractor the resolved extractor, {@code null} until resolved and for captures
 */
public record ExtractorSpec(
        Kind kind,
        CharSequence name,
        CharSequence arg,
        CharSequence format,
        CharSequence ext,
        int index,
        Extractor extractor) {

    /** Discriminator between text runs and references. */
    public enum Kind {
        LITERAL,
        EXTRACTOR
    }

    public ExtractorSpec {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(ext, "ext must not be null");
    }

    /** A literal text run. */
    public static ExtractorSpec literal(CharSequence text) {
        return new ExtractorSpec(Kind.LITERAL, "", null, "", text, -1, null);
    }

    /**
     * Parses the body of a specifier, {@code name[:format[:extension]]}. A {@code ':'} inside the
     * argument brackets does not end the name.
     *
     * @param text specifier text without enclosing braces
     * @return an unresolved reference
     * @throws ConfigSyntaxException if the name is empty
     */
    public static ExtractorSpec parse(CharSequence text) {
        String s = text.toString();
        int depth = 0;
        int nameEnd = s.length();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>' && depth > 0) {
                depth--;
            } else if (c == ':' && depth == 0) {
                nameEnd = i;
                break;
            }
        }
        String name = s.substring(0, nameEnd).trim();
        if (name.isEmpty()) {
            throw new ConfigSyntaxException("Invalid syntax for extractor \"" + s + "\" - not a valid specifier.");
        }
        String format = "";
        String ext = "";
        if (nameEnd < s.length()) {
            String rest = s.substring(nameEnd + 1);
            int colon = rest.indexOf(':');
            if (colon >= 0) {
                format = rest.substring(0, colon);
                ext = rest.substring(colon + 1);
            } else {
                format = rest;
            }
        }
        return new ExtractorSpec(Kind.EXTRACTOR, name, null, format, ext, captureIndex(name), null);
    }

    /** Copy of this reference bound to {@code extractor}, with the name and argument separated. */
    public ExtractorSpec resolve(Extractor extractor, CharSequence bareName, CharSequence argument, CharSequence extension) {
        return new ExtractorSpec(kind, bareName, argument, format, extension, index, extractor);
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public boolean isCapture() {
        return index >= 0;
    }

    /** The text of a literal run. */
    public CharSequence literalText() {
        return ext;
    }

    private static int captureIndex(String name) {
        if (name.length() > 9) {
            return -1;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        return Integer.parseInt(name);
    }

    @Override
    public String toString() {
        if (isLiteral()) {
            return "\"" + ext + "\"";
        }
        StringBuilder sb = new StringBuilder("{").append(name);
        if (arg != null) {
            sb.append('<').append(arg).append('>');
        }
        if (format.length() > 0 || ext.length() > 0) {
            sb.append(':').append(format);
        }
        if (ext.length() > 0) {
            sb.append(':').append(ext);
        }
        return sb.append('}').toString();
    }
}
