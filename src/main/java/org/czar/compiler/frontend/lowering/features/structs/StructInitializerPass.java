package org.czar.compiler.frontend.lowering.features.structs;

import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenStream;

/**
 * Turns empty initializers into zero initializers: {@code = {}} and {@code = Point {}}
 * (for a known struct {@code Point}) both become {@code = {0}}.
 */
public class StructInitializerPass implements ILoweringPass {

    public static final String NAME = "struct-init";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("=")) {
                continue;
            }
            int next = tokens.nextSignificant(i + 1);
            if (next < 0) {
                break;
            }
            Token candidate = tokens.get(next);
            int open = next;
            if (context.structTypes().contains(candidate.text())) {
                open = tokens.nextSignificant(next + 1);
            }
            if (open < 0 || !tokens.get(open).is("{")) {
                continue;
            }
            int close = tokens.findClosing(open);
            if (close < 0 || SourceStructure.hasSignificant(tokens, open + 1, close)) {
                continue;
            }
            if (open != next) {
                tokens.blankRange(next, open);
            }
            tokens.insert(open + 1, TokenBuilder.at(tokens.get(open).line()).number("0").build());
        }
    }
}
