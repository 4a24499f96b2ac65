package org.czar.compiler.frontend.lowering.features.mutability;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Enforces immutability by default.
 * <p>
 * CZar has a single mutability keyword, the writable marker {@code mut}. The C qualifier
 * {@code const} must not appear in source; this pass synthesizes it instead for every
 * function parameter and local declaration that is not marked writable, then strips the
 * marker. Pointer declarations are made constant on both sides of the {@code *}.
 * <p>
 * Hard errors: {@code const} in source, a writable parameter that is not a pointer, a
 * writable struct field, and a C-style loop counter that is not writable.
 */
public class MutabilityPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(MutabilityPass.class);

    public static final String NAME = "mutability";

    static final String CONST_IN_SOURCE = "Invalid 'const' keyword. In CZar, everything is immutable by default. "
            + "Use 'mut' for mutable declarations.";
    static final String MUT_NON_POINTER_PARAMETER = "Mutable parameter must be a pointer to have side effects. "
            + "Non-pointer parameters are passed by value. Use pointer type or remove 'mut'.";
    static final String MUT_STRUCT_FIELD = "Struct fields cannot have 'mut' qualifier. "
            + "Mutability is determined by the struct instance.";

    private enum InsertionKind { CONST_BEFORE_TYPE, CONST_AFTER_STAR }

    private record Insertion(int position, InsertionKind kind) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        rejectSourceConst(tokens, context);
        rejectMutFields(tokens, context);
        rejectImmutableLoopCounters(tokens, context);

        List<Insertion> insertions = new ArrayList<>();
        collectParameterInsertions(tokens, context, insertions);
        collectLocalInsertions(tokens, insertions);
        insertions.sort(Comparator.comparingInt(Insertion::position).reversed());
        for (Insertion insertion : insertions) {
            apply(tokens, insertion);
        }
        int stripped = stripMarkers(tokens);
        log.debug("{}: added {} const qualifiers, stripped {} writable markers", context.fileName(),
                insertions.size(), stripped);
    }

    private void rejectSourceConst(TokenStream tokens, CompilationContext context) {
        for (Token t : tokens.tokens()) {
            if (t.kind() == TokenKind.KEYWORD && t.is("const")) {
                context.diagnostics().reportError(CONST_IN_SOURCE, t.line());
            }
        }
    }

    private void rejectMutFields(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(Keywords.MUT) && SourceStructure.inAggregateBody(tokens, i)) {
                context.diagnostics().reportError(MUT_STRUCT_FIELD, t.line());
            }
        }
    }

    /** {@code for (i32 i = 0; ...)} declares a counter that the loop must modify. */
    private void rejectImmutableLoopCounters(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("for")) {
                continue;
            }
            int open = tokens.nextSignificant(i + 1);
            if (open < 0 || !tokens.get(open).is("(")) {
                continue;
            }
            int typeIndex = tokens.nextSignificant(open + 1);
            if (typeIndex < 0 || !tokens.get(typeIndex).isWord() || tokens.get(typeIndex).is(Keywords.MUT)) {
                continue;
            }
            int nameIndex = tokens.nextSignificant(typeIndex + 1);
            if (nameIndex < 0 || tokens.get(nameIndex).kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            int assign = tokens.nextSignificant(nameIndex + 1);
            if (assign >= 0 && tokens.get(assign).is("=")) {
                String name = tokens.get(nameIndex).text();
                String type = tokens.get(typeIndex).text();
                context.diagnostics().reportError("For-loop counter '" + name + "' must be mutable. Use: for (mut "
                        + type + " " + name + " ...)", tokens.get(nameIndex).line());
            }
        }
    }

    private void collectParameterInsertions(TokenStream tokens, CompilationContext context, List<Insertion> insertions) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("(") || !SourceStructure.isParameterListOpen(tokens, i)) {
                continue;
            }
            int close = tokens.findClosing(i);
            if (close < 0) {
                continue;
            }
            for (SourceStructure.Range param : SourceStructure.splitTopLevel(tokens, i, close)) {
                collectParameter(tokens, context, param, insertions);
            }
            i = close;
        }
    }

    private void collectParameter(TokenStream tokens, CompilationContext context, SourceStructure.Range param,
                                  List<Insertion> insertions) {
        List<Integer> significant = SourceStructure.significantIndices(tokens, param.start(), param.end());
        if (significant.isEmpty()) {
            return;
        }
        Token first = tokens.get(significant.get(0));
        int lastStar = -1;
        for (int index : significant) {
            Token t = tokens.get(index);
            if (t.is("(") || t.is("...") || t.is("const")) {
                return;
            }
            if (t.is("*")) {
                lastStar = index;
            }
        }
        if (first.is(Keywords.MUT)) {
            if (lastStar < 0) {
                context.diagnostics().reportError(MUT_NON_POINTER_PARAMETER, first.line());
            }
            return;
        }
        if ((significant.size() == 1 && first.is("void")) || Keywords.AGGREGATES.contains(first.text())) {
            return;
        }
        insertions.add(new Insertion(significant.get(0), InsertionKind.CONST_BEFORE_TYPE));
        if (lastStar >= 0) {
            insertions.add(new Insertion(lastStar, InsertionKind.CONST_AFTER_STAR));
        }
    }

    private void collectLocalInsertions(TokenStream tokens, List<Insertion> insertions) {
        for (int i = 0; i < tokens.size(); i++) {
            Token type = tokens.get(i);
            if (!type.isWord() || type.is(Keywords.MUT) || type.is("void")
                    || Keywords.NON_TYPE_KEYWORDS.contains(type.text())
                    || Keywords.AGGREGATES.contains(type.text())) {
                continue;
            }
            int next = tokens.nextSignificant(i + 1);
            if (next < 0) {
                break;
            }
            int star = -1;
            int nameIndex = next;
            if (tokens.get(next).is("*")) {
                star = next;
                nameIndex = tokens.nextSignificant(next + 1);
            }
            if (nameIndex < 0 || tokens.get(nameIndex).kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            int after = tokens.nextSignificant(nameIndex + 1);
            if (after < 0 || !isDeclaratorEnd(tokens.get(after))) {
                continue;
            }
            int prev = tokens.prevSignificant(i - 1);
            if (prev >= 0) {
                Token p = tokens.get(prev);
                if (p.is(Keywords.MUT) || p.is("const") || Keywords.AGGREGATES.contains(p.text())
                        || p.is(".") || p.is("->")) {
                    continue;
                }
            }
            if (!SourceStructure.atDeclarationStart(tokens, i) || !SourceStructure.inFunctionBody(tokens, i)) {
                continue;
            }
            insertions.add(new Insertion(i, InsertionKind.CONST_BEFORE_TYPE));
            if (star >= 0) {
                insertions.add(new Insertion(star, InsertionKind.CONST_AFTER_STAR));
            }
        }
    }

    private boolean isDeclaratorEnd(Token t) {
        return t.is("=") || t.is(";") || t.is(",") || t.is("[");
    }

    private void apply(TokenStream tokens, Insertion insertion) {
        Token anchor = tokens.get(insertion.position());
        if (insertion.kind() == InsertionKind.CONST_BEFORE_TYPE) {
            tokens.insert(insertion.position(), TokenBuilder.at(anchor.line()).word("const").space().build());
        } else {
            int following = insertion.position() + 1;
            if (following < tokens.size() && tokens.get(following).kind() == TokenKind.WHITESPACE) {
                tokens.blank(tokens.get(following));
            }
            tokens.insert(following, TokenBuilder.at(anchor.line()).space().word("const").space().build());
        }
    }

    /** Blanks every writable marker together with the whitespace that follows it. */
    private int stripMarkers(TokenStream tokens) {
        int stripped = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.is(Keywords.MUT)) {
                continue;
            }
            tokens.blank(t);
            if (i + 1 < tokens.size() && tokens.get(i + 1).kind() == TokenKind.WHITESPACE) {
                tokens.blank(tokens.get(i + 1));
            }
            stripped++;
        }
        return stripped;
    }
}
