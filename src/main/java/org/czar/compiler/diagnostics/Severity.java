package org.czar.compiler.diagnostics;

/**
 * Severity of a diagnostic. Errors are fatal to the compilation unit; warnings are not.
 */
public enum Severity {
    WARNING,
    ERROR
}
