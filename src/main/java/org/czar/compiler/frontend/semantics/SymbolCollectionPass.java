package org.czar.compiler.frontend.semantics;

import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.semantics.analysis.EnumSymbolCollector;
import org.czar.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.czar.compiler.frontend.semantics.analysis.MethodSymbolCollector;
import org.czar.compiler.frontend.semantics.analysis.PragmaCollector;
import org.czar.compiler.frontend.semantics.analysis.StructSymbolCollector;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Populates the context's registries. Runs first; every later pass treats the registries
 * as read-only.
 */
public class SymbolCollectionPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(SymbolCollectionPass.class);

    public static final String NAME = "symbols";

    private final List<ISymbolCollector> collectors;

    /**
     * Creates the pass with the default collectors. Method collection depends on struct
     * collection and therefore runs after it.
     */
    public SymbolCollectionPass() {
        this(List.of(
                new StructSymbolCollector(),
                new MethodSymbolCollector(),
                new EnumSymbolCollector(),
                new PragmaCollector()));
    }

    /**
     * @param collectors The collectors to run, in order.
     */
    public SymbolCollectionPass(List<ISymbolCollector> collectors) {
        this.collectors = List.copyOf(collectors);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        for (ISymbolCollector collector : collectors) {
            collector.collect(tokens, context);
        }
        log.debug("{}: collected {} struct types, {} methods, {} enums", context.fileName(),
                context.structTypes().names().size(), context.structMethods().methods().size(),
                context.enums().definitions().size());
    }
}
