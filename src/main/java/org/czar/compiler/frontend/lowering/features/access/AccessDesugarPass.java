package org.czar.compiler.frontend.lowering.features.access;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.frontend.semantics.PointerTrackingTable;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Rewrites member access on pointers: {@code p.x} becomes {@code p->x} when {@code p} is
 * declared as a pointer before the access.
 */
public class AccessDesugarPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(AccessDesugarPass.class);

    public static final String NAME = "access";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        PointerTrackingTable pointers = context.pointers();
        pointers.clear();
        trackParameters(tokens, pointers);
        trackLocals(tokens, pointers);

        int rewritten = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token dot = tokens.get(i);
            if (dot.kind() != TokenKind.OPERATOR || !dot.is(".")) {
                continue;
            }
            int base = tokens.prevSignificant(i - 1);
            int member = tokens.nextSignificant(i + 1);
            if (base < 0 || member < 0 || tokens.get(base).kind() != TokenKind.IDENTIFIER
                    || tokens.get(member).kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            int beforeBase = tokens.prevSignificant(base - 1);
            if (beforeBase >= 0 && (tokens.get(beforeBase).is(".") || tokens.get(beforeBase).is("->"))) {
                continue;
            }
            if (pointers.isPointerAt(tokens.get(base).text(), base)) {
                tokens.relabel(dot, TokenKind.OPERATOR, "->");
                rewritten++;
            }
        }
        log.debug("{}: rewrote {} pointer member accesses", context.fileName(), rewritten);
    }

    private void trackParameters(TokenStream tokens, PointerTrackingTable pointers) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("(") || !SourceStructure.isParameterListOpen(tokens, i)) {
                continue;
            }
            int close = tokens.findClosing(i);
            if (close < 0) {
                continue;
            }
            for (SourceStructure.Range param : SourceStructure.splitTopLevel(tokens, i, close)) {
                List<Integer> significant = SourceStructure.significantIndices(tokens, param.start(), param.end());
                if (significant.size() < 2) {
                    continue;
                }
                int nameIndex = significant.get(significant.size() - 1);
                boolean pointer = significant.stream().anyMatch(k -> tokens.get(k).is("*"));
                if (pointer && tokens.get(nameIndex).kind() == TokenKind.IDENTIFIER) {
                    pointers.track(tokens.get(nameIndex).text(), true, nameIndex);
                }
            }
            i = close;
        }
    }

    private void trackLocals(TokenStream tokens, PointerTrackingTable pointers) {
        for (int i = 0; i < tokens.size(); i++) {
            Token type = tokens.get(i);
            if (!type.isWord() || type.is("const") || Keywords.NON_TYPE_KEYWORDS.contains(type.text())) {
                continue;
            }
            int next = tokens.nextSignificant(i + 1);
            if (next < 0) {
                break;
            }
            boolean pointer = false;
            while (tokens.get(next).is("*") || tokens.get(next).is("const")) {
                pointer |= tokens.get(next).is("*");
                next = tokens.nextSignificant(next + 1);
                if (next < 0) {
                    return;
                }
            }
            if (tokens.get(next).kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            int after = tokens.nextSignificant(next + 1);
            if (after < 0) {
                continue;
            }
            Token end = tokens.get(after);
            if ((end.is("=") || end.is(";") || end.is(",") || end.is("["))
                    && SourceStructure.atDeclarationStart(tokens, i)
                    && SourceStructure.inFunctionBody(tokens, i)) {
                pointers.track(tokens.get(next).text(), pointer, next);
            }
        }
    }
}
