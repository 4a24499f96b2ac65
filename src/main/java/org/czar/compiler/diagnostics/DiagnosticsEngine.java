package org.czar.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects warnings and errors for one compilation unit.
 * <p>
 * Passes report here instead of throwing; the driver checks {@link #hasErrors()} after
 * every pass and aborts the unit on the first failing one.
 */
public class DiagnosticsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final String fileName;
    private final String[] sourceLines;
    private final boolean echoSourceLines;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates an engine without source text; diagnostics are attributed to {@code <input>}.
     */
    public DiagnosticsEngine() {
        this("<input>", null, false);
    }

    /**
     * Creates an engine for a named unit.
     * @param fileName        The file name used in formatted diagnostics.
     * @param source          The unit's source text used for line echoes, or null.
     * @param echoSourceLines Whether formatted diagnostics include the offending line.
     */
    public DiagnosticsEngine(String fileName, String source, boolean echoSourceLines) {
        this.fileName = fileName;
        this.sourceLines = source == null ? new String[0] : source.split("\r?\n", -1);
        this.echoSourceLines = echoSourceLines;
    }

    /**
     * Reports a fatal error.
     * @param message The error message.
     * @param line    The 1-based source line.
     */
    public void reportError(String message, int line) {
        report(Severity.ERROR, message, line);
    }

    /**
     * Reports a non-fatal warning.
     * @param message The warning message.
     * @param line    The 1-based source line.
     */
    public void reportWarning(String message, int line) {
        report(Severity.WARNING, message, line);
    }

    /**
     * Reports a diagnostic with the given severity.
     * @param severity The severity.
     * @param message  The message.
     * @param line     The 1-based source line.
     */
    public void report(Severity severity, String message, int line) {
        Diagnostic diagnostic = new Diagnostic(severity, message, fileName, line, echoSourceLines ? lineText(line) : null);
        diagnostics.add(diagnostic);
        log.debug("{}", diagnostic.format());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public int errorCount() {
        return (int) diagnostics.stream().filter(Diagnostic::isError).count();
    }

    public int warningCount() {
        return diagnostics.size() - errorCount();
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public String fileName() {
        return fileName;
    }

    /**
     * @return All diagnostics formatted one per entry, in reporting order.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining(System.lineSeparator()));
    }

    private String lineText(int line) {
        if (line < 1 || line > sourceLines.length) {
            return null;
        }
        return sourceLines[line - 1].trim();
    }
}
