package org.czar.compiler.frontend.lowering.features.casts;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Integer types a cast may target, with their C range limits as literal text.
 * CZar, stdint and plain C spellings share entries; {@code long} is taken as 64 bits.
 */
public final class CastTypeTable {

    /**
     * @param max Upper limit as a C literal.
     * @param min Lower limit as a C expression.
     */
    public record Bounds(String max, String min) {
    }

    private static final Map<String, Bounds> BOUNDS = new HashMap<>();

    static {
        put(new Bounds("255", "0"), "u8", "uint8_t");
        put(new Bounds("65535", "0"), "u16", "uint16_t");
        put(new Bounds("4294967295U", "0"), "u32", "uint32_t");
        put(new Bounds("18446744073709551615ULL", "0"), "u64", "uint64_t");
        put(new Bounds("127", "-128"), "i8", "int8_t", "char");
        put(new Bounds("32767", "-32768"), "i16", "int16_t", "short");
        put(new Bounds("2147483647", "(-2147483647-1)"), "i32", "int32_t", "int");
        put(new Bounds("9223372036854775807LL", "(-9223372036854775807LL-1)"), "i64", "int64_t", "long");
    }

    private CastTypeTable() {
    }

    private static void put(Bounds bounds, String... names) {
        for (String name : names) {
            BOUNDS.put(name, bounds);
        }
    }

    /**
     * @param typeName A single-word type name.
     * @return The range limits, if the type is a known integer type.
     */
    public static Optional<Bounds> boundsOf(String typeName) {
        return Optional.ofNullable(BOUNDS.get(typeName));
    }

    public static boolean isKnownIntegerType(String typeName) {
        return BOUNDS.containsKey(typeName);
    }
}
