package org.czar.compiler.frontend.semantics.analysis;

import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code #pragma czar debug true|false}. The last directive in the unit wins.
 * The directive token itself is left in the stream untouched.
 */
public class PragmaCollector implements ISymbolCollector {

    private static final Logger log = LoggerFactory.getLogger(PragmaCollector.class);

    private static final Pattern DEBUG_PRAGMA = Pattern.compile("#\\s*pragma\\s+czar\\s+debug\\s+(true|false)\\b.*", Pattern.DOTALL);

    @Override
    public void collect(TokenStream tokens, CompilationContext context) {
        for (Token t : tokens.tokens()) {
            if (t.kind() != TokenKind.PREPROCESSOR) {
                continue;
            }
            Matcher m = DEBUG_PRAGMA.matcher(t.text().trim());
            if (m.matches()) {
                boolean debug = Boolean.parseBoolean(m.group(1));
                context.setDebugMode(debug);
                log.debug("{}:{}: debug mode set to {}", context.fileName(), t.line(), debug);
            }
        }
    }
}
