package org.czar.compiler.frontend.lowering;

import org.czar.compiler.TranspilerOptions;
import org.czar.compiler.frontend.lowering.features.access.AccessDesugarPass;
import org.czar.compiler.frontend.lowering.features.casts.CastLoweringPass;
import org.czar.compiler.frontend.lowering.features.enums.EnumLoweringPass;
import org.czar.compiler.frontend.lowering.features.loops.LoopDesugarPass;
import org.czar.compiler.frontend.lowering.features.methods.MethodLoweringPass;
import org.czar.compiler.frontend.lowering.features.mutability.MutabilityPass;
import org.czar.compiler.frontend.lowering.features.names.BuiltinNamePass;
import org.czar.compiler.frontend.lowering.features.names.TypeNamePass;
import org.czar.compiler.frontend.lowering.features.structs.StructInitializerPass;
import org.czar.compiler.frontend.lowering.features.structs.StructTypedefPass;
import org.czar.compiler.frontend.lowering.features.switches.SwitchControlFlowPass;
import org.czar.compiler.frontend.lowering.features.validation.DeclarationInitPass;
import org.czar.compiler.frontend.semantics.SymbolCollectionPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered registry of lowering passes. Registration order is execution order.
 */
public final class LoweringPassRegistry {

    private final List<ILoweringPass> passes = new ArrayList<>();

    /**
     * Appends a pass to the pipeline.
     * @param pass The pass to run after all previously registered passes.
     * @throws IllegalArgumentException if a pass with the same name is already registered.
     */
    public void register(ILoweringPass pass) {
        if (get(pass.name()).isPresent()) {
            throw new IllegalArgumentException("Duplicate lowering pass name: " + pass.name());
        }
        passes.add(pass);
    }

    /**
     * @param name A pass name.
     * @return The registered pass, if any.
     */
    public Optional<ILoweringPass> get(String name) {
        return passes.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public List<ILoweringPass> passes() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * @param options The options naming disabled passes.
     * @return The registered passes that are enabled, in execution order.
     */
    public List<ILoweringPass> enabledPasses(TranspilerOptions options) {
        return passes.stream().filter(p -> options.isPassEnabled(p.name())).toList();
    }

    /**
     * Creates a registry with the default pipeline.
     * <p>
     * Loop desugaring runs before mutability enforcement because it inserts the writable
     * marker on induction variables, which the mutability pass strips. Access desugaring
     * runs after every pass that introduces pointer declarations.
     * @return A fully initialized registry.
     */
    public static LoweringPassRegistry initializeWithDefaults() {
        LoweringPassRegistry registry = new LoweringPassRegistry();
        registry.register(new SymbolCollectionPass());
        registry.register(new StructTypedefPass());
        registry.register(new StructInitializerPass());
        registry.register(new MethodLoweringPass());
        registry.register(new LoopDesugarPass());
        registry.register(new DeclarationInitPass());
        registry.register(new MutabilityPass());
        registry.register(new CastLoweringPass());
        registry.register(new EnumLoweringPass());
        registry.register(new SwitchControlFlowPass());
        registry.register(new AccessDesugarPass());
        registry.register(new BuiltinNamePass());
        registry.register(new TypeNamePass());
        return registry;
    }
}
