package org.czar.compiler.frontend.lexer;

import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder for synthesized token runs. Passes use it to create the tokens they
 * splice into a stream; generated tokens carry the line of the construct they replace
 * so diagnostics raised by later passes still point at the user's source.
 */
public final class TokenBuilder {

    private final int line;
    private final List<Token> tokens = new ArrayList<>();

    private TokenBuilder(int line) {
        this.line = line;
    }

    /**
     * @param line The source line the synthesized tokens are attributed to.
     * @return A new empty builder.
     */
    public static TokenBuilder at(int line) {
        return new TokenBuilder(line);
    }

    /** Appends a keyword or identifier, classified by {@link Keywords#isReserved}. */
    public TokenBuilder word(String text) {
        return add(Keywords.isReserved(text) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, text);
    }

    public TokenBuilder op(String text) {
        return add(TokenKind.OPERATOR, text);
    }

    public TokenBuilder punct(String text) {
        return add(TokenKind.PUNCTUATION, text);
    }

    public TokenBuilder number(String text) {
        return add(TokenKind.NUMBER, text);
    }

    public TokenBuilder string(String text) {
        return add(TokenKind.STRING, text);
    }

    public TokenBuilder space() {
        return add(TokenKind.WHITESPACE, " ");
    }

    public TokenBuilder whitespace(String text) {
        return add(TokenKind.WHITESPACE, text);
    }

    /**
     * Appends copies of existing tokens, preserving their kind and text.
     * @param source The tokens to copy; blank tokens are skipped.
     * @return this builder.
     */
    public TokenBuilder copyOf(List<Token> source) {
        for (Token t : source) {
            if (!t.isBlank()) {
                tokens.add(new Token(t.kind(), t.text(), t.line(), t.column()));
            }
        }
        return this;
    }

    public List<Token> build() {
        return tokens;
    }

    private TokenBuilder add(TokenKind kind, String text) {
        tokens.add(new Token(kind, text, line, 0));
        return this;
    }
}
