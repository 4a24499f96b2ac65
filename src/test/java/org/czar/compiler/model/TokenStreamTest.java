package org.czar.compiler.model;

import org.czar.compiler.diagnostics.DiagnosticsEngine;
import org.czar.compiler.frontend.lexer.Lexer;
import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the editing and navigation primitives of the token stream.
 */
public class TokenStreamTest {

    private TokenStream stream(String source) {
        return new TokenStream(new Lexer(source, new DiagnosticsEngine()).scanTokens());
    }

    private TokenStream stream(String source, int maxTokens) {
        return new TokenStream(new Lexer(source, new DiagnosticsEngine()).scanTokens(), maxTokens);
    }

    @Test
    @Tag("unit")
    void testBlankedTokensAreSkippedButKeepTheirSlot() {
        // Arrange
        TokenStream tokens = stream("a b c");
        int sizeBefore = tokens.size();

        // Act
        tokens.blank(tokens.get(2));

        // Assert
        assertThat(tokens.size()).isEqualTo(sizeBefore);
        assertThat(tokens.render()).isEqualTo("a  c");
        assertThat(tokens.nextSignificant(1)).isEqualTo(4);
        assertThat(tokens.prevSignificant(3)).isEqualTo(0);
    }

    @Test
    @Tag("unit")
    void testInsertShiftsTrailingTokens() {
        TokenStream tokens = stream("f(x);");

        boolean inserted = tokens.insert(2, TokenBuilder.at(1).op("&").build());

        assertThat(inserted).isTrue();
        assertThat(tokens.render()).isEqualTo("f(&x);");
    }

    @Test
    @Tag("unit")
    void testInsertBeyondCeilingIsSkipped() {
        // Arrange: "a b" is three tokens
        TokenStream tokens = stream("a b", 4);

        // Act
        boolean first = tokens.insert(3, TokenBuilder.at(1).punct(";").build());
        boolean second = tokens.insert(4, TokenBuilder.at(1).punct(";").build());

        // Assert
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(tokens.render()).isEqualTo("a b;");
    }

    @Test
    @Tag("unit")
    void testInsertOutOfRangeThrows() {
        TokenStream tokens = stream("a");

        assertThatThrownBy(() -> tokens.insert(5, TokenBuilder.at(1).punct(";").build()))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @Tag("unit")
    void testFindClosingIgnoresBracketsInStrings() {
        TokenStream tokens = stream("f(\")\", (a));");

        int close = tokens.findClosing(1);

        assertThat(tokens.get(close).is(")")).isTrue();
        assertThat(tokens.nextSignificant(close + 1)).isEqualTo(tokens.size() - 1);
    }

    @Test
    @Tag("unit")
    void testFindClosingReturnsMinusOneWhenUnbalanced() {
        TokenStream tokens = stream("{ { }");

        assertThat(tokens.findClosing(0)).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void testFindEnclosingOpenSkipsClosedGroups() {
        TokenStream tokens = stream("{ (a) { } x }");
        int x = 0;
        while (!tokens.get(x).is("x")) {
            x++;
        }

        assertThat(tokens.findEnclosingOpen(x, "{")).isEqualTo(0);
        assertThat(tokens.findEnclosingOpen(x, "(")).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void testRelabelChangesKindAndText() {
        TokenStream tokens = stream("cast");
        Token token = tokens.get(0);

        tokens.relabel(token, TokenKind.PUNCTUATION, "(");

        assertThat(token.kind()).isEqualTo(TokenKind.PUNCTUATION);
        assertThat(token.text()).isEqualTo("(");
    }

    @Test
    @Tag("unit")
    void testTokensViewIsUnmodifiable() {
        TokenStream tokens = stream("a");

        assertThatThrownBy(() -> tokens.tokens().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
