package org.czar.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.czar.compiler.diagnostics.Severity;
import org.czar.compiler.frontend.semantics.CapacityPolicy;

import java.util.Set;

/**
 * Typed view of the {@code czar} configuration block.
 *
 * @param echoSourceLines      Whether diagnostics echo the offending source line.
 * @param maxTokens            Ceiling for token stream growth.
 * @param capacityPolicy       Behaviour when a registry limit is reached.
 * @param maxStructTypes       Struct type registry limit.
 * @param maxMethods           Method registry limit, built-ins included.
 * @param maxEnums             Enum registry limit.
 * @param maxEnumMembers       Member limit per enum.
 * @param enumCaseSeverity     Severity of a non upper-case enum member.
 * @param requireEnumDefault   Whether an exhaustive enum switch still needs a default.
 * @param disabledPasses       Names of lowering passes that are skipped.
 */
public record TranspilerOptions(
        boolean echoSourceLines,
        int maxTokens,
        CapacityPolicy capacityPolicy,
        int maxStructTypes,
        int maxMethods,
        int maxEnums,
        int maxEnumMembers,
        Severity enumCaseSeverity,
        boolean requireEnumDefault,
        Set<String> disabledPasses) {

    private static final String ROOT = "czar";

    /**
     * Reads options from a resolved application config.
     * @param config The config containing a {@code czar} block.
     * @return The typed options.
     * @throws com.typesafe.config.ConfigException if a value is missing or malformed.
     */
    public static TranspilerOptions fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        return new TranspilerOptions(
                c.getBoolean("diagnostics.echo-source-lines"),
                c.getInt("stream.max-tokens"),
                c.getEnum(CapacityPolicy.class, "registries.capacity-policy"),
                c.getInt("registries.max-struct-types"),
                c.getInt("registries.max-methods"),
                c.getInt("registries.max-enums"),
                c.getInt("registries.max-enum-members"),
                c.getEnum(Severity.class, "enums.uppercase-severity"),
                c.getBoolean("switch.require-enum-default"),
                Set.copyOf(c.getStringList("passes.disabled")));
    }

    /**
     * @return The options defined by {@code reference.conf} alone.
     */
    public static TranspilerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public boolean isPassEnabled(String passName) {
        return !disabledPasses.contains(passName);
    }
}
