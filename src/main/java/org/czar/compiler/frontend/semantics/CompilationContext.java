package org.czar.compiler.frontend.semantics;

import org.czar.compiler.TranspilerOptions;
import org.czar.compiler.diagnostics.DiagnosticsEngine;

/**
 * Per-unit state threaded through every lowering pass.
 * <p>
 * The driver creates one context per compilation unit. Registries are populated by the
 * symbol collection pass and are read-only for every later pass.
 */
public class CompilationContext {

    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private final TranspilerOptions options;
    private final StructTypeRegistry structTypes;
    private final StructMethodRegistry structMethods;
    private final EnumRegistry enums;
    private final PointerTrackingTable pointers = new PointerTrackingTable();
    private boolean debugMode = true;
    private int generatedNameCounter = 0;
    private int discardCounter = 0;

    /**
     * Creates a fresh context with empty registries (methods seeded with built-ins).
     * @param fileName    The unit's file name.
     * @param diagnostics The unit's diagnostics engine.
     * @param options     The transpiler options.
     */
    public CompilationContext(String fileName, DiagnosticsEngine diagnostics, TranspilerOptions options) {
        this.fileName = fileName;
        this.diagnostics = diagnostics;
        this.options = options;
        this.structTypes = new StructTypeRegistry(options.maxStructTypes(), options.capacityPolicy(), diagnostics);
        this.structMethods = new StructMethodRegistry(options.maxMethods(), options.capacityPolicy(), diagnostics);
        this.enums = new EnumRegistry(options.maxEnums(), options.maxEnumMembers(), options.capacityPolicy(), diagnostics);
    }

    public String fileName() {
        return fileName;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public TranspilerOptions options() {
        return options;
    }

    public StructTypeRegistry structTypes() {
        return structTypes;
    }

    public StructMethodRegistry structMethods() {
        return structMethods;
    }

    public EnumRegistry enums() {
        return enums;
    }

    public PointerTrackingTable pointers() {
        return pointers;
    }

    /**
     * @return The value of the last {@code #pragma czar debug} directive; true by default.
     */
    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    /**
     * Generates a name that cannot collide with user identifiers in this unit.
     * @param stem A readable stem, e.g. {@code "i"}.
     * @return A name like {@code _cz_i0}.
     */
    public String generateName(String stem) {
        return "_cz_" + stem + (generatedNameCounter++);
    }

    /**
     * Names the next {@code _} discard variable of this unit. Numbering restarts with
     * every unit.
     * @return A name like {@code _unused_0}.
     */
    public String nextDiscardName() {
        return "_unused_" + (discardCounter++);
    }
}
