package org.czar.compiler.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The flat, ordered token sequence of one compilation unit.
 * <p>
 * Nesting is never materialized: passes recompute brace and parenthesis depth by scanning
 * token text. Structural edits are limited to three primitives: {@link #insert},
 * {@link #blank} and {@link #relabel}. Blanking keeps the token in place so that indices
 * held by a pass stay valid; insertion shifts every trailing token, so callers must re-read
 * {@link #size()} and re-derive positions after inserting.
 * <p>
 * The stream has a token ceiling. An insertion that would exceed it is skipped with a
 * warning and the calling pass continues with a partially lowered unit.
 */
public class TokenStream {

    private static final Logger log = LoggerFactory.getLogger(TokenStream.class);

    /** Ceiling used when none is configured. */
    public static final int DEFAULT_MAX_TOKENS = 4_000_000;

    private final List<Token> tokens;
    private final int maxTokens;
    private boolean ceilingWarned = false;

    /**
     * Creates a stream over a copy of the given tokens with the default ceiling.
     * @param initialTokens The tokens produced by the lexer.
     */
    public TokenStream(List<Token> initialTokens) {
        this(initialTokens, DEFAULT_MAX_TOKENS);
    }

    /**
     * Creates a stream over a copy of the given tokens.
     * @param initialTokens The tokens produced by the lexer.
     * @param maxTokens     The maximum number of tokens the stream may grow to.
     */
    public TokenStream(List<Token> initialTokens, int maxTokens) {
        this.tokens = new ArrayList<>(initialTokens);
        this.maxTokens = maxTokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * @return An unmodifiable live view of the tokens.
     */
    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Finds the position of a token by identity.
     * @param token The token to look for.
     * @return Its index, or -1 if it is not part of the stream.
     */
    public int indexOf(Token token) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i) == token) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Inserts tokens at the given position, shifting all trailing tokens right.
     * @param position  The index the first inserted token will occupy.
     * @param newTokens The tokens to insert.
     * @return true if the tokens were inserted, false if the edit was skipped because the
     *         stream would exceed its ceiling.
     */
    public boolean insert(int position, List<Token> newTokens) {
        if (position < 0 || position > tokens.size()) {
            throw new IndexOutOfBoundsException("Insert position " + position + " outside stream of size " + tokens.size());
        }
        if (tokens.size() + newTokens.size() > maxTokens) {
            if (!ceilingWarned) {
                log.warn("Token stream ceiling of {} tokens reached; further insertions are skipped", maxTokens);
                ceilingWarned = true;
            }
            return false;
        }
        tokens.addAll(position, newTokens);
        return true;
    }

    /**
     * Logically deletes a token by emptying its text. The token keeps its slot.
     * @param token The token to blank.
     */
    public void blank(Token token) {
        token.replace(token.kind(), "");
    }

    /**
     * Blanks every token in the half-open range {@code [from, to)}.
     * @param from First index, inclusive.
     * @param to   Last index, exclusive.
     */
    public void blankRange(int from, int to) {
        for (int i = from; i < to; i++) {
            blank(tokens.get(i));
        }
    }

    /**
     * Replaces kind and text of a token in one step.
     * @param token   The token to rewrite.
     * @param newKind The new lexical category.
     * @param newText The new text.
     */
    public void relabel(Token token, TokenKind newKind, String newText) {
        token.replace(newKind, newText);
    }

    /**
     * Replaces the text of a token, keeping its kind.
     * @param token   The token to rewrite.
     * @param newText The new text.
     */
    public void relabel(Token token, String newText) {
        token.replace(token.kind(), newText);
    }

    /**
     * @param from Index to start at, inclusive.
     * @return The index of the first significant token at or after {@code from}, or -1.
     */
    public int nextSignificant(int from) {
        for (int i = Math.max(from, 0); i < tokens.size(); i++) {
            if (tokens.get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param from Index to start at, inclusive, scanning backwards.
     * @return The index of the closest significant token at or before {@code from}, or -1.
     */
    public int prevSignificant(int from) {
        for (int i = Math.min(from, tokens.size() - 1); i >= 0; i--) {
            if (tokens.get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param index An index, possibly out of range.
     * @param text  The expected text.
     * @return true if {@code index} is in range and the token there has the given text.
     */
    public boolean textAt(int index, String text) {
        return index >= 0 && index < tokens.size() && tokens.get(index).is(text);
    }

    /**
     * Finds the bracket closing the one at {@code openIndex} by depth counting.
     * Only brackets of the same family are counted.
     * @param openIndex The index of a {@code (}, {@code [} or <code>{</code> token.
     * @return The index of the matching close bracket, or -1 if the stream ends first.
     */
    public int findClosing(int openIndex) {
        String open = tokens.get(openIndex).text();
        String close = switch (open) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            default -> throw new IllegalArgumentException("Not an opening bracket: '" + open + "'");
        };
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.kind() != TokenKind.PUNCTUATION) {
                continue;
            }
            if (t.is(open)) {
                depth++;
            } else if (t.is(close)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the opening bracket of the innermost enclosing block or group of the given
     * family that is still open at {@code index}.
     * @param index The position to look from (exclusive).
     * @param open  {@code "("}, {@code "["} or <code>"{"</code>.
     * @return The index of the enclosing opening bracket, or -1 at top level.
     */
    public int findEnclosingOpen(int index, String open) {
        String close = switch (open) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            default -> throw new IllegalArgumentException("Not an opening bracket: '" + open + "'");
        };
        int depth = 0;
        for (int i = index - 1; i >= 0; i--) {
            Token t = tokens.get(i);
            if (t.kind() != TokenKind.PUNCTUATION) {
                continue;
            }
            if (t.is(close)) {
                depth++;
            } else if (t.is(open)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    /**
     * Renders the current token texts back into source text.
     * @return The concatenated text of all tokens.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.text());
        }
        return sb.toString();
    }
}
