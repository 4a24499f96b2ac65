package org.czar.compiler.frontend.lowering;

import com.typesafe.config.ConfigFactory;
import org.czar.compiler.TranspilerOptions;
import org.czar.compiler.diagnostics.Diagnostic;
import org.czar.compiler.diagnostics.DiagnosticsEngine;
import org.czar.compiler.frontend.lexer.Lexer;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.TokenStream;

import java.util.List;

/**
 * Lexes a snippet and runs a chosen sequence of passes over it.
 */
public final class LoweringFixture {

    /**
     * @param output      The rendered tokens after the last pass.
     * @param diagnostics The engine all passes reported into.
     * @param context     The unit's context.
     * @param tokens      The lowered stream.
     */
    public record Result(String output, DiagnosticsEngine diagnostics, CompilationContext context, TokenStream tokens) {

        public List<String> errors() {
            return diagnostics.diagnostics().stream().filter(Diagnostic::isError).map(Diagnostic::message).toList();
        }

        public List<String> warnings() {
            return diagnostics.diagnostics().stream().filter(d -> !d.isError()).map(Diagnostic::message).toList();
        }
    }

    private LoweringFixture() {
    }

    public static Result run(String source, ILoweringPass... passes) {
        return run(TranspilerOptions.defaults(), source, passes);
    }

    public static Result run(TranspilerOptions options, String source, ILoweringPass... passes) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TokenStream tokens = new TokenStream(new Lexer(source, diagnostics).scanTokens(), options.maxTokens());
        CompilationContext context = new CompilationContext("test.cz", diagnostics, options);
        for (ILoweringPass pass : passes) {
            pass.apply(tokens, context);
        }
        return new Result(tokens.render(), diagnostics, context, tokens);
    }

    /**
     * @param hocon Overrides of the {@code czar} block, e.g. {@code "czar.switch.require-enum-default = false"}.
     * @return Options with the overrides applied over the defaults.
     */
    public static TranspilerOptions options(String hocon) {
        return TranspilerOptions.fromConfig(ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.defaultReference()).resolve());
    }
}
