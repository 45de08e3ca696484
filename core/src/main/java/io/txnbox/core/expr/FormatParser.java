package io.txnbox.core.expr;

import io.txnbox.core.error.ConfigSyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits composite expression text into literal runs and brace delimited specifiers, e.g.
 * {@code "http://{ua-req-host}/{1}"}. A doubled brace ({@code "{{"} or {@code "}}"}) stands for
 * the brace itself. A single {@code '}'} outside a specifier is literal text.
 *
 * <p>Thread-safe and stateless.
 */
public final class FormatParser {

    /**
     * A literal run followed by an optional specifier.
     *
     * @param literal literal text preceding the specifier, possibly empty
     * @param spec    the specifier, or {@code null} at the end of the text
     * @param offset  offset of the specifier's opening brace, or the text length
     */
    public record Token(String literal, ExtractorSpec spec, int offset) {}

    private FormatParser() {}

    /**
     * @param text composite expression text
     * @return tokens in text order
     * @throws ConfigSyntaxException for an unterminated or empty specifier
     */
    public static List<Token> tokenize(CharSequence text) {
        String s = text.toString();
        List<Token> tokens = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '{') {
                if (i + 1 < s.length() && s.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = s.indexOf('}', i + 1);
                if (close < 0) {
                    throw new ConfigSyntaxException(
                            "Specifier at offset " + i + " in \"" + s + "\" is not terminated with '}'.");
                }
                ExtractorSpec spec;
                try {
                    spec = ExtractorSpec.parse(s.substring(i + 1, close));
                } catch (ConfigSyntaxException e) {
                    e.addContext("While parsing specifier at offset %d.", i);
                    throw e;
                }
                tokens.add(new Token(literal.toString(), spec, i));
                literal.setLength(0);
                i = close + 1;
            } else if (c == '}' && i + 1 < s.length() && s.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            tokens.add(new Token(literal.toString(), null, s.length()));
        }
        return tokens;
    }
}
