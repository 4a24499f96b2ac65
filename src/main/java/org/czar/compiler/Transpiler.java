package org.czar.compiler;

import org.czar.compiler.api.CompilationException;
import org.czar.compiler.backend.SourceEmitter;
import org.czar.compiler.diagnostics.DiagnosticsEngine;
import org.czar.compiler.frontend.lexer.Lexer;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.LoweringPassRegistry;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drives the lowering pipeline for one compilation unit at a time.
 * <p>
 * Every unit gets a fresh {@link CompilationContext}, so a single instance can transpile
 * any number of units. Passes run in registration order; the unit is abandoned after the
 * first pass that reports an error.
 */
public class Transpiler {

    private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

    private final TranspilerOptions options;
    private final LoweringPassRegistry passes;

    /**
     * Creates a transpiler running the default pipeline.
     * @param options The transpiler options.
     */
    public Transpiler(TranspilerOptions options) {
        this(options, LoweringPassRegistry.initializeWithDefaults());
    }

    /**
     * Creates a transpiler running a custom pipeline.
     * @param options The transpiler options.
     * @param passes  The passes to run, in order.
     */
    public Transpiler(TranspilerOptions options, LoweringPassRegistry passes) {
        this.options = options;
        this.passes = passes;
    }

    public TranspilerOptions getOptions() {
        return options;
    }

    /**
     * Lexes and lowers one unit of CZar source.
     * @param source   The unit's source text.
     * @param fileName The name used in diagnostics.
     * @return The generated C source.
     * @throws CompilationException if lexing or any pass reported an error.
     */
    public String transpileSource(String source, String fileName) throws CompilationException {
        return transpileSource(source, fileName, new DiagnosticsEngine(fileName, source, options.echoSourceLines()));
    }

    /**
     * Lexes and lowers one unit, reporting into a caller-supplied engine so that warnings
     * of a successful unit stay available.
     * @param source      The unit's source text.
     * @param fileName    The name used in diagnostics.
     * @param diagnostics The engine for this unit.
     * @return The generated C source.
     * @throws CompilationException if lexing or any pass reported an error.
     */
    public String transpileSource(String source, String fileName, DiagnosticsEngine diagnostics)
            throws CompilationException {
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        failOnErrors(diagnostics, "lexer");
        return SourceEmitter.emit(transpile(tokens, fileName, diagnostics));
    }

    /**
     * Runs every enabled pass over a token list.
     * @param tokens      The unit's tokens, in source order.
     * @param fileName    The name used in diagnostics.
     * @param diagnostics The engine for this unit.
     * @return The lowered tokens.
     * @throws CompilationException if a pass reported an error.
     */
    public List<Token> transpile(List<Token> tokens, String fileName, DiagnosticsEngine diagnostics)
            throws CompilationException {
        TokenStream stream = new TokenStream(tokens, options.maxTokens());
        CompilationContext context = new CompilationContext(fileName, diagnostics, options);
        for (ILoweringPass pass : passes.enabledPasses(options)) {
            log.debug("{}: running pass '{}' over {} tokens", fileName, pass.name(), stream.size());
            pass.apply(stream, context);
            failOnErrors(diagnostics, pass.name());
        }
        log.debug("{}: lowered with {} warning(s)", fileName, diagnostics.warningCount());
        return stream.tokens();
    }

    private void failOnErrors(DiagnosticsEngine diagnostics, String stage) throws CompilationException {
        if (diagnostics.hasErrors()) {
            log.debug("{}: aborting after '{}' with {} error(s)", diagnostics.fileName(), stage,
                    diagnostics.errorCount());
            throw new CompilationException(diagnostics.summary(), diagnostics.diagnostics());
        }
    }
}
