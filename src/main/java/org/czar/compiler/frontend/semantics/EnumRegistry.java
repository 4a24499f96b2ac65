package org.czar.compiler.frontend.semantics;

import org.czar.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enum definitions of the compilation unit, in declaration order.
 */
public class EnumRegistry {

    private final Map<String, EnumDefinition> enums = new LinkedHashMap<>();
    private final CapacityGuard enumGuard;
    private final CapacityGuard memberGuard;

    public EnumRegistry(int maxEnums, int maxMembers, CapacityPolicy policy, DiagnosticsEngine diagnostics) {
        this.enumGuard = new CapacityGuard(maxEnums, policy, diagnostics);
        this.memberGuard = new CapacityGuard(maxMembers, policy, diagnostics);
    }

    /**
     * Registers an enum with its members. Members beyond the per-enum limit are dropped
     * according to the capacity policy.
     * @param name        The enum name.
     * @param memberNames The member names in declaration order.
     * @param line        The line of the declaration.
     * @return The registered definition, or empty if the enum could not be tracked.
     */
    public Optional<EnumDefinition> register(String name, List<String> memberNames, int line) {
        if (enums.containsKey(name)) {
            return Optional.of(enums.get(name));
        }
        if (!enumGuard.admit(enums.size(), line, "Maximum number of tracked enums (" + enumGuard.limit()
                + ") reached. Exhaustiveness checking may be incomplete for enum '" + name + "'.")) {
            return Optional.empty();
        }
        List<EnumDefinition.Member> members = new ArrayList<>();
        for (String memberName : memberNames) {
            if (!memberGuard.admit(members.size(), line, "Maximum enum member tracking limit (" + memberGuard.limit()
                    + ") reached for enum '" + name + "'. Exhaustiveness checking may be incomplete.")) {
                break;
            }
            members.add(new EnumDefinition.Member(memberName, EnumDefinition.prefixedName(name, memberName)));
        }
        EnumDefinition definition = new EnumDefinition(name, members);
        enums.put(name, definition);
        return Optional.of(definition);
    }

    public Optional<EnumDefinition> find(String name) {
        return Optional.ofNullable(enums.get(name));
    }

    public boolean contains(String name) {
        return enums.containsKey(name);
    }

    public Collection<EnumDefinition> definitions() {
        return Collections.unmodifiableCollection(enums.values());
    }
}
