package org.czar.compiler.frontend.lexer;

import java.util.Set;

/**
 * Word classification shared by the lexer and the lowering passes.
 */
public final class Keywords {

    /** Reserved words of C plus the CZar writable marker. */
    public static final Set<String> RESERVED = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while", "bool",
            "mut");

    /** Words that start a statement or modify storage; they are never a declaration's type. */
    public static final Set<String> NON_TYPE_KEYWORDS = Set.of(
            "return", "if", "else", "while", "for", "do", "switch", "case", "default", "break",
            "continue", "goto", "sizeof", "typedef", "static", "extern", "auto", "register",
            "inline", "volatile", "restrict");

    /** Primitive type spellings, C and CZar, recognized in declarations and casts. */
    public static final Set<String> PRIMITIVE_TYPES = Set.of(
            "void", "char", "short", "int", "long", "float", "double", "signed", "unsigned", "bool",
            "int8_t", "int16_t", "int32_t", "int64_t", "uint8_t", "uint16_t", "uint32_t", "uint64_t",
            "size_t", "ptrdiff_t",
            "i8", "i16", "i32", "i64", "u8", "u16", "u32", "u64", "f32", "f64", "isize", "usize");

    /** Keywords that introduce an aggregate tag. */
    public static final Set<String> AGGREGATES = Set.of("struct", "union", "enum");

    /** The writable marker. */
    public static final String MUT = "mut";

    private Keywords() {
    }

    public static boolean isReserved(String word) {
        return RESERVED.contains(word);
    }

    public static boolean isPrimitiveType(String word) {
        return PRIMITIVE_TYPES.contains(word);
    }
}
