package org.czar.compiler.frontend.semantics;

import org.czar.compiler.diagnostics.DiagnosticsEngine;

/**
 * Applies a {@link CapacityPolicy} to one registry. Under {@link CapacityPolicy#WARN_AND_CONTINUE}
 * the warning is reported only once per registry and unit.
 */
final class CapacityGuard {

    private final int limit;
    private final CapacityPolicy policy;
    private final DiagnosticsEngine diagnostics;
    private boolean warned = false;

    CapacityGuard(int limit, CapacityPolicy policy, DiagnosticsEngine diagnostics) {
        this.limit = limit;
        this.policy = policy;
        this.diagnostics = diagnostics;
    }

    /**
     * Decides whether one more entry may be added.
     * @param currentSize The registry's size before adding.
     * @param line        The source line of the entry, for the diagnostic.
     * @param message     The message reported when the entry is refused.
     * @return true if the entry may be added.
     */
    boolean admit(int currentSize, int line, String message) {
        if (policy == CapacityPolicy.UNBOUNDED || currentSize < limit) {
            return true;
        }
        if (policy == CapacityPolicy.FAIL) {
            diagnostics.reportError(message, line);
        } else if (!warned) {
            diagnostics.reportWarning(message, line);
            warned = true;
        }
        return false;
    }

    int limit() {
        return limit;
    }
}
