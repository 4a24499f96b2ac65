package org.czar.compiler.frontend.semantics;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * An enum declared in the compilation unit. Member order is declaration order and defines
 * the coverage vector used by switch validation.
 *
 * @param name    The enum name as written.
 * @param members The members in declaration order.
 */
public record EnumDefinition(String name, List<Member> members) {

    /**
     * @param name         The surface spelling, e.g. {@code RED}.
     * @param prefixedName The generated output name, e.g. {@code COLOR_RED}.
     */
    public record Member(String name, String prefixedName) {
    }

    public EnumDefinition {
        members = List.copyOf(members);
    }

    /**
     * @param enumName   The enum name.
     * @param memberName The member name.
     * @return The collision-free output name {@code ENUMNAME_MEMBER}.
     */
    public static String prefixedName(String enumName, String memberName) {
        return enumName.toUpperCase(Locale.ROOT) + "_" + memberName;
    }

    /**
     * @param memberName A surface member name.
     * @return Its position in the member list, or -1.
     */
    public int indexOf(String memberName) {
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).name().equals(memberName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Accepts either spelling of a member.
     * @param anyName A surface or prefixed member name.
     * @return The position in the member list, or -1.
     */
    public int indexOfAnySpelling(String anyName) {
        for (int i = 0; i < members.size(); i++) {
            Member m = members.get(i);
            if (m.name().equals(anyName) || m.prefixedName().equals(anyName)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<Member> member(String memberName) {
        int index = indexOf(memberName);
        return index < 0 ? Optional.empty() : Optional.of(members.get(index));
    }
}
