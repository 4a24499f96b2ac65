package org.czar.compiler.frontend.lexer;

import org.czar.compiler.diagnostics.DiagnosticsEngine;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits CZar source text into a flat token list. Whitespace and comments are kept as
 * tokens so that rendering the list reproduces the input exactly.
 * <p>
 * Preprocessor directives are lexed as a single token spanning the whole logical line,
 * including backslash continuations; lowering passes never look inside them.
 */
public class Lexer {

    private static final String[] OPERATORS = {
            "<<=", ">>=", "...",
            "->", "++", "--", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "..",
            "+", "-", "*", "/", "%", "=", "<", ">", "!", "&", "|", "^", "~", "?", ":", ".", "#"
    };

    private static final String PUNCTUATION = "{}()[];,";

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean atLineStart = true;

    /**
     * Creates a lexer for one compilation unit.
     * @param source      The complete source text.
     * @param diagnostics The engine for reporting lexical errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     * @return The tokens in source order.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
            while (!isAtEnd() && Character.isWhitespace(peek())) {
                advance();
            }
            addToken(TokenKind.WHITESPACE);
            return;
        }
        boolean lineStart = atLineStart;
        atLineStart = false;

        if (c == '#' && lineStart) {
            directive();
        } else if (c == '/' && peek() == '/') {
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
            addToken(TokenKind.COMMENT);
        } else if (c == '/' && peek() == '*') {
            blockComment();
        } else if (c == '"' || c == '\'') {
            quoted(c);
        } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek()))) {
            number();
        } else if (Character.isLetter(c) || c == '_') {
            while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                advance();
            }
            String word = source.substring(start, current);
            addToken(Keywords.isReserved(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER);
        } else if (PUNCTUATION.indexOf(c) >= 0) {
            addToken(TokenKind.PUNCTUATION);
        } else {
            operator();
        }
    }

    private void directive() {
        while (!isAtEnd() && peek() != '\n') {
            if (peek() == '\\' && peekNext() == '\n') {
                advance();
            }
            advance();
        }
        addToken(TokenKind.PREPROCESSOR);
    }

    private void blockComment() {
        advance();
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            advance();
        }
        if (isAtEnd()) {
            diagnostics.reportError("Unterminated block comment", startLine);
        } else {
            advance();
            advance();
        }
        addToken(TokenKind.COMMENT);
    }

    private void quoted(char quote) {
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            if (peek() == '\\') {
                advance();
            }
            if (!isAtEnd()) {
                advance();
            }
        }
        if (isAtEnd() || peek() != quote) {
            diagnostics.reportError("Unterminated " + (quote == '"' ? "string" : "character") + " literal", startLine);
        } else {
            advance();
        }
        addToken(TokenKind.STRING);
    }

    private void number() {
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (!isAtEnd() && Character.digit(peek(), 16) >= 0) {
                advance();
            }
        } else {
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
            // A '.' belongs to the number only when a digit follows, so "0..3" stays a range
            if (peek() == '.' && Character.isDigit(peekNext())) {
                advance();
                while (!isAtEnd() && Character.isDigit(peek())) {
                    advance();
                }
            }
            if ((peek() == 'e' || peek() == 'E')
                    && (Character.isDigit(peekNext()) || peekNext() == '+' || peekNext() == '-')) {
                advance();
                advance();
                while (!isAtEnd() && Character.isDigit(peek())) {
                    advance();
                }
            }
        }
        while (!isAtEnd() && Character.isLetter(peek())) {
            advance();
        }
        addToken(TokenKind.NUMBER);
    }

    private void operator() {
        current = start;
        column = startColumn;
        for (String op : OPERATORS) {
            if (source.startsWith(op, start)) {
                for (int i = 0; i < op.length(); i++) {
                    advance();
                }
                addToken(TokenKind.OPERATOR);
                return;
            }
        }
        advance();
        diagnostics.reportWarning("Unexpected character '" + source.charAt(start) + "'", startLine);
        addToken(TokenKind.OPERATOR);
    }

    private void addToken(TokenKind kind) {
        tokens.add(new Token(kind, source.substring(start, current), startLine, startColumn));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
            atLineStart = true;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
