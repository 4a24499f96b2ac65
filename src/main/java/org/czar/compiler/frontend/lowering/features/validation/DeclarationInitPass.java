package org.czar.compiler.frontend.lowering.features.validation;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rejects local declarations without an initializer. CZar requires every local variable
 * to be explicitly initialized, e.g. {@code i32 x = 0;} or {@code Point p = {0};}.
 * Struct bodies, parameters and globals are not checked.
 */
public class DeclarationInitPass implements ILoweringPass {

    public static final String NAME = "declarations";

    private static final Set<String> QUALIFIERS = Set.of("const", "volatile", "static", "register", "auto");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            Token type = tokens.get(i);
            if (!type.isWord()) {
                continue;
            }
            boolean aggregate = Keywords.AGGREGATES.contains(type.text());
            boolean structName = context.structTypes().contains(type.text());
            if (!aggregate && !structName && !Keywords.isPrimitiveType(type.text())) {
                continue;
            }
            if (followsMemberOrTagKeyword(tokens, i) || insideParentheses(tokens, i) || !SourceStructure.inFunctionBody(tokens, i)) {
                continue;
            }
            checkDeclaration(tokens, context, i, aggregate, aggregate || structName);
        }
    }

    private void checkDeclaration(TokenStream tokens, CompilationContext context, int typeIndex,
                                  boolean aggregateKeyword, boolean zeroInitHint) {
        int j = tokens.nextSignificant(typeIndex + 1);
        int typeEnd = typeIndex + 1;
        if (aggregateKeyword && j >= 0 && tokens.get(j).kind() == TokenKind.IDENTIFIER) {
            typeEnd = j + 1;
            j = tokens.nextSignificant(j + 1);
        }
        while (j >= 0 && QUALIFIERS.contains(tokens.get(j).text())) {
            j = tokens.nextSignificant(j + 1);
        }
        while (j >= 0 && tokens.get(j).is("*")) {
            j = tokens.nextSignificant(j + 1);
        }
        if (j < 0 || tokens.get(j).kind() != TokenKind.IDENTIFIER) {
            return;
        }
        Token variable = tokens.get(j);
        int next = tokens.nextSignificant(j + 1);
        if (next >= 0 && tokens.get(next).is("[")) {
            int closeBracket = tokens.findClosing(next);
            next = closeBracket < 0 ? -1 : tokens.nextSignificant(closeBracket + 1);
        }
        if (next < 0) {
            return;
        }
        Token after = tokens.get(next);
        String typeText = SourceStructure.compactText(tokens, typeIndex, typeEnd);
        String prefix = functionName(tokens, typeIndex).map(f -> "[in " + f + "()] ").orElse("");
        if (after.is(";")) {
            context.diagnostics().reportError(prefix + "Variable '" + variable.text()
                    + "' must be explicitly initialized. CZar requires zero-initialization: "
                    + typeText + " " + variable.text() + " = 0;" + (zeroInitHint ? " or = {0};" : ""), variable.line());
        } else if (after.is(",")) {
            context.diagnostics().reportError(prefix + "Variable '" + variable.text()
                    + "' must be explicitly initialized. CZar requires zero-initialization", variable.line());
        }
    }

    private boolean followsMemberOrTagKeyword(TokenStream tokens, int index) {
        int prev = tokens.prevSignificant(index - 1);
        return prev >= 0 && (tokens.get(prev).is(".") || tokens.get(prev).is("->")
                || Keywords.AGGREGATES.contains(tokens.get(prev).text()));
    }

    private boolean insideParentheses(TokenStream tokens, int index) {
        int paren = tokens.findEnclosingOpen(index, "(");
        return paren >= 0 && paren > tokens.findEnclosingOpen(index, "{");
    }

    private Optional<String> functionName(TokenStream tokens, int index) {
        List<Integer> braces = SourceStructure.enclosingBraces(tokens, index);
        if (braces.isEmpty()) {
            return Optional.empty();
        }
        int outer = braces.get(braces.size() - 1);
        if (SourceStructure.blockKind(tokens, outer) != SourceStructure.BlockKind.FUNCTION) {
            return Optional.empty();
        }
        int close = tokens.prevSignificant(outer - 1);
        int open = tokens.findEnclosingOpen(close, "(");
        int name = tokens.prevSignificant(open - 1);
        return Optional.of(tokens.get(name).text());
    }
}
