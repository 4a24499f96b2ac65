package org.czar.compiler.api;

import org.czar.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a compilation unit fails validation. The message contains every diagnostic
 * reported for the unit in CZar console format; no output is produced for such a unit.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * @param message     The formatted diagnostics.
     * @param diagnostics The diagnostics that caused the failure.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
