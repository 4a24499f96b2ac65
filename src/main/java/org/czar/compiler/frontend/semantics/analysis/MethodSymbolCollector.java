package org.czar.compiler.frontend.semantics.analysis;

import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;

/**
 * Registers method declarations of the form {@code Struct.method(params) {}} where
 * {@code Struct} is a known struct type. Must run after {@link StructSymbolCollector}.
 */
public class MethodSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            Token receiver = tokens.get(i);
            if (receiver.kind() != TokenKind.IDENTIFIER || !context.structTypes().contains(receiver.text())) {
                continue;
            }
            int dot = tokens.nextSignificant(i + 1);
            if (dot < 0 || !tokens.get(dot).is(".")) {
                continue;
            }
            int methodIndex = tokens.nextSignificant(dot + 1);
            if (methodIndex < 0 || tokens.get(methodIndex).kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            int open = tokens.nextSignificant(methodIndex + 1);
            if (open < 0 || !tokens.get(open).is("(")) {
                continue;
            }
            int close = tokens.findClosing(open);
            if (close < 0) {
                continue;
            }
            int body = tokens.nextSignificant(close + 1);
            if (body >= 0 && tokens.get(body).is("{")) {
                Token method = tokens.get(methodIndex);
                context.structMethods().register(receiver.text(), method.text(), method.line());
            }
        }
    }
}
