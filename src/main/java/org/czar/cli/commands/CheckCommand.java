package org.czar.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

import org.czar.cli.CommandLineInterface;
import org.czar.compiler.Transpiler;
import org.czar.compiler.TranspilerOptions;
import org.czar.compiler.api.CompilationException;
import org.czar.compiler.diagnostics.Diagnostic;
import org.czar.compiler.diagnostics.DiagnosticsEngine;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the full pipeline without writing output and reports the diagnostics.
 */
@Command(
    name = "check",
    mixinStandardHelpOptions = true,
    description = "Validate CZar source files without generating C"
)
public class CheckCommand implements Callable<Integer> {

    @Parameters(
        arity = "1..*",
        paramLabel = "FILE",
        description = "CZar source files"
    )
    private List<File> inputs;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final TranspilerOptions options = TranspilerOptions.fromConfig(parent.getConfig());
        final Transpiler transpiler = new Transpiler(options);

        int failed = 0;
        for (File input : inputs) {
            try {
                final String source = Files.readString(input.toPath(), StandardCharsets.UTF_8);
                final DiagnosticsEngine diagnostics = new DiagnosticsEngine(input.getName(), source,
                        options.echoSourceLines());
                transpiler.transpileSource(source, input.getName(), diagnostics);
                if (diagnostics.warningCount() > 0) {
                    err.println(diagnostics.summary());
                }
                out.printf("%s: OK (%d warning(s))%n", input.getName(), diagnostics.warningCount());
            } catch (CompilationException e) {
                err.println(e.getMessage());
                out.printf("%s: FAILED (%d error(s))%n", input.getName(),
                        e.getDiagnostics().stream().filter(Diagnostic::isError).count());
                failed++;
            } catch (IOException e) {
                err.println("Error: cannot read " + input + ": " + e.getMessage());
                failed++;
            }
        }
        out.flush();
        err.flush();
        return failed > 0 ? 1 : 0;
    }
}
