package org.czar.compiler.diagnostics;

/**
 * A single message reported against a source location.
 *
 * @param severity   Whether this diagnostic is fatal.
 * @param message    The human-readable message.
 * @param fileName   The file the message refers to.
 * @param line       The 1-based line number, or 0 if unknown.
 * @param sourceLine The trimmed offending source line, or null if it should not be echoed.
 */
public record Diagnostic(Severity severity, String message, String fileName, int line, String sourceLine) {

    /**
     * Renders the diagnostic in the CZar console format, e.g.
     * {@code [CZAR] WARNING at main.cz:12: message}, followed by an indented echo of the
     * source line when one is available.
     * @return The formatted text, without a trailing newline.
     */
    public String format() {
        StringBuilder sb = new StringBuilder()
                .append("[CZAR] ").append(severity).append(" at ")
                .append(fileName).append(':').append(line).append(": ")
                .append(message);
        if (sourceLine != null && !sourceLine.isEmpty()) {
            sb.append(System.lineSeparator()).append("    > ").append(sourceLine);
        }
        return sb.toString();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
