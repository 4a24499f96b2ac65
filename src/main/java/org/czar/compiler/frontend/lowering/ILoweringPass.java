package org.czar.compiler.frontend.lowering;

import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.TokenStream;

/**
 * A single pass of the lowering pipeline. A pass validates and rewrites the token stream
 * of one compilation unit in place and reports problems to the context's diagnostics.
 * Passes run to completion one after another; none is interleaved with another.
 */
public interface ILoweringPass {

    /**
     * @return The stable name of the pass, used in configuration and logs.
     */
    String name();

    /**
     * Applies the pass to the token stream.
     * @param tokens  The unit's token stream, modified in place.
     * @param context The unit's compilation context.
     */
    void apply(TokenStream tokens, CompilationContext context);
}
