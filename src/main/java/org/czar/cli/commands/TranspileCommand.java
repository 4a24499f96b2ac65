package org.czar.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.czar.cli.CommandLineInterface;
import org.czar.compiler.Transpiler;
import org.czar.compiler.TranspilerOptions;
import org.czar.compiler.api.CompilationException;
import org.czar.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Transpiles CZar files to C.
 * <p>
 * Each input is an independent compilation unit. A unit with errors produces no output
 * file; the remaining units are still processed and the command exits with status 1.
 */
@Command(
    name = "transpile",
    mixinStandardHelpOptions = true,
    description = "Transpile CZar source files to C"
)
public class TranspileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranspileCommand.class);

    @Parameters(
        arity = "1..*",
        paramLabel = "FILE",
        description = "CZar source files"
    )
    private List<File> inputs;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: next to each input file)"
    )
    private File outputDir;

    @Option(
        names = {"--stdout"},
        description = "Write generated C to standard output instead of files"
    )
    private boolean toStdout;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final Config config = parent.getConfig();
        final TranspilerOptions options = TranspilerOptions.fromConfig(config);
        final String extension = config.getString("czar.output.extension");
        final Transpiler transpiler = new Transpiler(options);

        int failed = 0;
        for (File input : inputs) {
            try {
                final String source = Files.readString(input.toPath(), StandardCharsets.UTF_8);
                final DiagnosticsEngine diagnostics = new DiagnosticsEngine(input.getName(), source,
                        options.echoSourceLines());
                final String generated = transpiler.transpileSource(source, input.getName(), diagnostics);
                if (!diagnostics.diagnostics().isEmpty()) {
                    err.println(diagnostics.summary());
                }
                if (toStdout) {
                    out.print(generated);
                    out.flush();
                } else {
                    final Path target = outputPathFor(input, extension);
                    Files.writeString(target, generated, StandardCharsets.UTF_8);
                    log.info("Transpiled {} -> {}", input, target);
                }
            } catch (CompilationException e) {
                err.println(e.getMessage());
                failed++;
            } catch (IOException e) {
                err.println("Error: cannot process " + input + ": " + e.getMessage());
                failed++;
            }
        }
        err.flush();
        if (failed > 0) {
            log.debug("{} of {} unit(s) failed", failed, inputs.size());
            return 1;
        }
        return 0;
    }

    private Path outputPathFor(File input, String extension) throws IOException {
        final String name = input.getName();
        final int dot = name.lastIndexOf('.');
        final String baseName = dot > 0 ? name.substring(0, dot) : name;
        final Path directory = outputDir != null
                ? outputDir.toPath()
                : input.getAbsoluteFile().toPath().getParent();
        Files.createDirectories(directory);
        return directory.resolve(baseName + "." + extension);
    }
}
