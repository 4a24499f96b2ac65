package org.czar.compiler.frontend.semantics.analysis;

import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.TokenStream;

/**
 * A declaration scanner run during symbol collection. Each collector forward-scans the
 * whole token stream once for one kind of declaration and registers what it finds in the
 * context's registries. Collectors never modify the stream.
 */
public interface ISymbolCollector {

    /**
     * Scans the stream and populates registries.
     * @param tokens  The token stream to scan.
     * @param context The compilation context holding the registries.
     */
    void collect(TokenStream tokens, CompilationContext context);
}
