package org.czar.compiler.backend;

import org.czar.compiler.diagnostics.DiagnosticsEngine;
import org.czar.compiler.frontend.lexer.Lexer;
import org.czar.compiler.model.TokenStream;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests emission of lowered tokens.
 */
public class SourceEmitterTest {

    @Test
    @Tag("unit")
    void testBlankedTokensVanishFromOutput() throws IOException {
        // Arrange
        TokenStream tokens = new TokenStream(new Lexer("a /* c */ b;\n", new DiagnosticsEngine()).scanTokens());
        tokens.blank(tokens.get(0));
        StringWriter writer = new StringWriter();

        // Act
        String text = SourceEmitter.emit(tokens.tokens());
        SourceEmitter.emit(tokens.tokens(), writer);

        // Assert
        assertThat(text).isEqualTo(" /* c */ b;\n");
        assertThat(writer.toString()).isEqualTo(text);
    }
}
