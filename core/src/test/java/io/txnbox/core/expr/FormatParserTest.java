package io.txnbox.core.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.txnbox.core.error.ConfigSyntaxException;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FormatParserTest {

    @Test
    void splitsLiteralRunsAndSpecifiers() {
        List<FormatParser.Token> tokens = FormatParser.tokenize("http://{ua-req-host}/base/{1}");

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).literal()).isEqualTo("http://");
        assertThat(tokens.get(0).spec().name()).hasToString("ua-req-host");
        assertThat(tokens.get(0).offset()).isEqualTo(7);
        assertThat(tokens.get(1).literal()).isEqualTo("/base/");
        assertThat(tokens.get(1).spec().index()).isEqualTo(1);
    }

    @Test
    void trailingLiteralHasNoSpecifier() {
        List<FormatParser.Token> tokens = FormatParser.tokenize("{ua-req-path}.html");

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).literal()).isEmpty();
        assertThat(tokens.get(1).literal()).isEqualTo(".html");
        assertThat(tokens.get(1).spec()).isNull();
    }

    @Test
    void doubledBracesAreLiteral() {
        List<FormatParser.Token> tokens = FormatParser.tokenize("{{not}} a spec");

        assertThat(tokens).singleElement().satisfies(t -> {
            assertThat(t.literal()).isEqualTo("{not} a spec");
            assertThat(t.spec()).isNull();
        });
    }

    @Test
    void unterminatedSpecifierIsSyntaxError() {
        assertThatThrownBy(() -> FormatParser.tokenize("abc{ua-req-host"))
                .isInstanceOf(ConfigSyntaxException.class)
                .hasMessageContaining("offset 3");
    }

    @Test
    void emptySpecifierIsSyntaxErrorWithOffset() {
        assertThatThrownBy(() -> FormatParser.tokenize("ab{}"))
                .isInstanceOf(ConfigSyntaxException.class)
                .hasMessageContaining("While parsing specifier at offset 2.");
    }

    @Nested
    class Specifiers {

        @Test
        void nameFormatAndExtension() {
            ExtractorSpec spec = ExtractorSpec.parse("ua-req-field<Host>:fmt:ext");

            assertThat(spec.name()).hasToString("ua-req-field<Host>");
            assertThat(spec.format()).hasToString("fmt");
            assertThat(spec.ext()).hasToString("ext");
            assertThat(spec.isCapture()).isFalse();
        }

        @Test
        void colonInsideArgumentDoesNotEndName() {
            ExtractorSpec spec = ExtractorSpec.parse("env<A:B>:upper");

            assertThat(spec.name()).hasToString("env<A:B>");
            assertThat(spec.format()).hasToString("upper");
        }

        @Test
        void numericNameIsCaptureGroup() {
            assertThat(ExtractorSpec.parse("3").index()).isEqualTo(3);
            assertThat(ExtractorSpec.parse("3a").index()).isEqualTo(-1);
        }

        @Test
        void literalRunKeepsText() {
            ExtractorSpec spec = ExtractorSpec.literal("abc");

            assertThat(spec.isLiteral()).isTrue();
            assertThat(spec.literalText()).hasToString("abc");
            assertThat(spec).hasToString("\"abc\"");
        }
    }
}
