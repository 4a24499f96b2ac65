package org.czar.compiler.model;

/**
 * Lexical categories of CZar tokens.
 */
public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    OPERATOR,
    PUNCTUATION,
    STRING,
    NUMBER,
    WHITESPACE,
    COMMENT,
    PREPROCESSOR
}
