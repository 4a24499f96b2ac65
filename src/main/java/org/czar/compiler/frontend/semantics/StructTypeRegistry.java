package org.czar.compiler.frontend.semantics;

import org.czar.compiler.diagnostics.DiagnosticsEngine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Logical names of the structs defined in the current compilation unit.
 */
public class StructTypeRegistry {

    private final Set<String> names = new LinkedHashSet<>();
    private final CapacityGuard guard;

    public StructTypeRegistry(int limit, CapacityPolicy policy, DiagnosticsEngine diagnostics) {
        this.guard = new CapacityGuard(limit, policy, diagnostics);
    }

    /**
     * Records a struct name. Re-registering a known name is a no-op.
     * @param name The logical struct name.
     * @param line The line of the definition.
     * @return true if the name is registered after the call.
     */
    public boolean register(String name, int line) {
        if (names.contains(name)) {
            return true;
        }
        if (!guard.admit(names.size(), line,
                "Maximum struct type tracking limit (" + guard.limit() + ") reached")) {
            return false;
        }
        names.add(name);
        return true;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(names);
    }
}
