package org.czar.compiler.model;

import java.util.Objects;

/**
 * A single lexical token of a compilation unit.
 * <p>
 * Unlike most value types in the compiler, a token is mutable: lowering passes replace its
 * text wholesale ({@link TokenStream#relabel}) or empty it ({@link TokenStream#blank}).
 * The length of a token is always the length of its current text.
 */
public final class Token {

    private TokenKind kind;
    private String text;
    private final int line;
    private final int column;

    /**
     * Creates a new token.
     * @param kind   The lexical category.
     * @param text   The token text, never null.
     * @param line   The 1-based source line.
     * @param column The 1-based source column.
     */
    public Token(TokenKind kind, String text, int line, int column) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.line = line;
        this.column = column;
    }

    public TokenKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public int length() {
        return text.length();
    }

    /**
     * @return true if the token was logically deleted.
     */
    public boolean isBlank() {
        return text.isEmpty();
    }

    /**
     * A token is significant if it carries syntax: it is neither whitespace, a comment,
     * nor blanked.
     * @return true if passes should look at this token.
     */
    public boolean isSignificant() {
        return !text.isEmpty() && kind != TokenKind.WHITESPACE && kind != TokenKind.COMMENT;
    }

    /**
     * @param candidate The text to compare against.
     * @return true if the token text equals {@code candidate}.
     */
    public boolean is(String candidate) {
        return text.equals(candidate);
    }

    /**
     * @return true if the token is an identifier or a keyword, i.e. a word.
     */
    public boolean isWord() {
        return !text.isEmpty() && (kind == TokenKind.IDENTIFIER || kind == TokenKind.KEYWORD);
    }

    void replace(TokenKind newKind, String newText) {
        this.kind = Objects.requireNonNull(newKind, "kind");
        this.text = Objects.requireNonNull(newText, "text");
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + line + ":" + column;
    }
}
