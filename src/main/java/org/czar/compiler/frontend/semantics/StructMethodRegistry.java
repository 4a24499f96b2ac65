package org.czar.compiler.frontend.semantics;

import org.czar.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Methods declared on structs, as ordered (struct, method) pairs.
 * <p>
 * The registry is seeded with the methods of the built-in {@code Log} facility before the
 * unit is scanned. Lookup by method name returns the first struct, in registration order,
 * that declares it.
 */
public class StructMethodRegistry {

    /** Receiver name of the built-in logging facility. */
    public static final String LOG_STRUCT = "Log";

    private static final List<String> LOG_METHODS = List.of("verbose", "debug", "info", "warning", "error", "fatal");

    /**
     * A method declared on a struct.
     * @param structName The logical struct name.
     * @param methodName The method name.
     */
    public record StructMethod(String structName, String methodName) {
    }

    private final List<StructMethod> methods = new ArrayList<>();
    private final CapacityGuard guard;

    public StructMethodRegistry(int limit, CapacityPolicy policy, DiagnosticsEngine diagnostics) {
        this.guard = new CapacityGuard(limit, policy, diagnostics);
        for (String method : LOG_METHODS) {
            methods.add(new StructMethod(LOG_STRUCT, method));
        }
    }

    /**
     * Records a method declaration. Duplicates are ignored.
     * @param structName The struct the method is declared on.
     * @param methodName The method name.
     * @param line       The line of the declaration.
     * @return true if the pair is registered after the call.
     */
    public boolean register(String structName, String methodName, int line) {
        if (contains(structName, methodName)) {
            return true;
        }
        if (!guard.admit(methods.size(), line, "Maximum method tracking limit (" + guard.limit() + ") reached")) {
            return false;
        }
        methods.add(new StructMethod(structName, methodName));
        return true;
    }

    public boolean contains(String structName, String methodName) {
        return methods.contains(new StructMethod(structName, methodName));
    }

    /**
     * Resolves a method name to the first struct declaring it. The built-in {@code Log}
     * methods are never candidates for instance calls.
     * @param methodName The method name.
     * @return The owning struct, if any.
     */
    public Optional<String> findFirstOwner(String methodName) {
        return owners(methodName).stream().findFirst();
    }

    /**
     * @param methodName The method name.
     * @return Every user struct declaring the method, in registration order.
     */
    public List<String> owners(String methodName) {
        List<String> owners = new ArrayList<>();
        for (StructMethod m : methods) {
            if (m.methodName().equals(methodName) && !LOG_STRUCT.equals(m.structName())) {
                owners.add(m.structName());
            }
        }
        return owners;
    }

    public List<StructMethod> methods() {
        return Collections.unmodifiableList(methods);
    }
}
