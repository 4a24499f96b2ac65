package org.czar.compiler.frontend.semantics.analysis;

import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;

/**
 * Registers struct definitions: {@code struct Name {}}, {@code typedef struct Name_s {} Name_t;}
 * and anonymous {@code typedef struct {} Name;}. Storage ({@code _s}) and alias ({@code _t})
 * suffixes are stripped so every spelling keys on the logical name.
 */
public class StructSymbolCollector implements ISymbolCollector {

    /** Maximum distance between the struct name and its opening brace. */
    static final int BRACE_LOOKAHEAD = 10;

    @Override
    public void collect(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.is("struct")) {
                continue;
            }
            int next = tokens.nextSignificant(i + 1);
            if (next < 0) {
                break;
            }
            int braceIndex;
            Token name = tokens.get(next);
            if (name.kind() == TokenKind.IDENTIFIER) {
                braceIndex = tokens.nextSignificant(next + 1);
                if (braceIndex < 0 || braceIndex - next > BRACE_LOOKAHEAD || !tokens.get(braceIndex).is("{")) {
                    continue;
                }
                context.structTypes().register(stripSuffix(name.text(), "_s"), name.line());
            } else if (name.is("{")) {
                braceIndex = next;
            } else {
                continue;
            }
            int prev = tokens.prevSignificant(i - 1);
            if (prev >= 0 && tokens.get(prev).is("typedef")) {
                registerTypedefName(tokens, braceIndex, context);
            }
        }
    }

    private void registerTypedefName(TokenStream tokens, int braceIndex, CompilationContext context) {
        int close = tokens.findClosing(braceIndex);
        if (close < 0) {
            return;
        }
        int aliasIndex = tokens.nextSignificant(close + 1);
        if (aliasIndex >= 0 && tokens.get(aliasIndex).kind() == TokenKind.IDENTIFIER) {
            Token alias = tokens.get(aliasIndex);
            context.structTypes().register(stripSuffix(alias.text(), "_t"), alias.line());
        }
    }

    static String stripSuffix(String name, String suffix) {
        if (name.length() > suffix.length() && name.endsWith(suffix)) {
            return name.substring(0, name.length() - suffix.length());
        }
        return name;
    }
}
