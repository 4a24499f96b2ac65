package org.czar.compiler.frontend.lowering.features.names;

import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Maps the built-in names of CZar to C.
 * <ul>
 *   <li>Diagnostics macros become runtime functions, e.g. {@code UNREACHABLE("x")} to
 *       {@code cz_unreachable("x")}. Only call sites are renamed.</li>
 *   <li>Every {@code _} identifier becomes a fresh {@code _unused_N} marked
 *       {@code __attribute__((unused))}, so {@code i32 _ = g();} discards a result without
 *       an unused-variable warning.</li>
 * </ul>
 */
public class BuiltinNamePass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(BuiltinNamePass.class);

    public static final String NAME = "builtins";

    static final String DISCARD = "_";

    private static final Map<String, String> BUILTINS = Map.of(
            "UNREACHABLE", "cz_unreachable",
            "TODO", "cz_todo",
            "FIXME", "cz_fixme",
            "ASSERT", "cz_assert");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        int discards = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            if (t.is(DISCARD)) {
                tokens.relabel(t, context.nextDiscardName());
                List<Token> attribute = TokenBuilder.at(t.line())
                        .space().word("__attribute__").punct("(").punct("(").word("unused").punct(")").punct(")")
                        .build();
                if (tokens.insert(i + 1, attribute)) {
                    i += attribute.size();
                }
                discards++;
                continue;
            }
            String runtimeName = BUILTINS.get(t.text());
            if (runtimeName == null) {
                continue;
            }
            int open = tokens.nextSignificant(i + 1);
            if (open >= 0 && tokens.get(open).is("(")) {
                tokens.relabel(t, runtimeName);
            }
        }
        log.debug("{}: renamed {} discard variables", context.fileName(), discards);
    }
}
