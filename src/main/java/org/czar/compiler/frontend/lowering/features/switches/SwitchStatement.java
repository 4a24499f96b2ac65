package org.czar.compiler.frontend.lowering.features.switches;

import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Token positions of a {@code switch (subject) { ... }} statement. Positions are only valid
 * until the stream is edited before {@code bodyClose}.
 *
 * @param keyword      Index of the {@code switch} keyword.
 * @param subjectOpen  Index of the opening parenthesis.
 * @param subjectClose Index of the closing parenthesis.
 * @param bodyOpen     Index of the body's opening brace.
 * @param bodyClose    Index of the body's closing brace.
 */
public record SwitchStatement(int keyword, int subjectOpen, int subjectClose, int bodyOpen, int bodyClose) {

    /**
     * @param tokens  The token stream.
     * @param keyword Index of a candidate {@code switch} keyword.
     * @return The statement, if the keyword starts a well-formed braced switch.
     */
    public static Optional<SwitchStatement> at(TokenStream tokens, int keyword) {
        if (!tokens.get(keyword).is("switch") || tokens.get(keyword).kind() != TokenKind.KEYWORD) {
            return Optional.empty();
        }
        int open = tokens.nextSignificant(keyword + 1);
        if (open < 0 || !tokens.get(open).is("(")) {
            return Optional.empty();
        }
        int close = tokens.findClosing(open);
        int body = close < 0 ? -1 : tokens.nextSignificant(close + 1);
        if (body < 0 || !tokens.get(body).is("{")) {
            return Optional.empty();
        }
        int bodyClose = tokens.findClosing(body);
        if (bodyClose < 0) {
            return Optional.empty();
        }
        return Optional.of(new SwitchStatement(keyword, open, close, body, bodyClose));
    }

    /**
     * @param tokens The token stream.
     * @return The subject when it is a plain identifier, e.g. {@code c} in {@code switch (c)}.
     */
    public Optional<Token> subjectIdentifier(TokenStream tokens) {
        List<Integer> subject = SourceStructure.significantIndices(tokens, subjectOpen + 1, subjectClose);
        if (subject.isEmpty() || tokens.get(subject.get(0)).kind() != TokenKind.IDENTIFIER) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(subject.get(0)));
    }

    /**
     * @param tokens The token stream.
     * @return Indices of the {@code case} and {@code default} labels that belong to this
     *         switch, excluding labels of nested switches.
     */
    public List<Integer> labels(TokenStream tokens) {
        List<Integer> labels = new ArrayList<>();
        for (int i = bodyOpen + 1; i < bodyClose; i++) {
            Token t = tokens.get(i);
            if (t.kind() == TokenKind.KEYWORD && (t.is("case") || t.is("default"))
                    && nearestSwitchBody(tokens, i) == bodyOpen) {
                labels.add(i);
            }
        }
        return labels;
    }

    /**
     * @param tokens The token stream.
     * @return true if one of this switch's labels is {@code default}.
     */
    public boolean hasDefault(TokenStream tokens) {
        return labels(tokens).stream().anyMatch(i -> tokens.get(i).is("default"));
    }

    /**
     * @param tokens The token stream.
     * @param index  A token index.
     * @return The opening brace of the innermost switch body enclosing {@code index}, or -1.
     */
    public static int nearestSwitchBody(TokenStream tokens, int index) {
        for (int brace : SourceStructure.enclosingBraces(tokens, index)) {
            if (SourceStructure.blockKind(tokens, brace) == SourceStructure.BlockKind.SWITCH) {
                return brace;
            }
        }
        return -1;
    }
}
