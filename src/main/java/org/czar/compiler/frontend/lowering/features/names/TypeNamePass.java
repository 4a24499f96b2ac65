package org.czar.compiler.frontend.lowering.features.names;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Replaces CZar primitive type names and their limit constants with their C equivalents,
 * e.g. {@code u8} to {@code uint8_t} and {@code U8_MAX} to {@code UINT8_MAX}. Runs last, so
 * earlier passes only ever see the CZar spellings.
 */
public class TypeNamePass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(TypeNamePass.class);

    public static final String NAME = "types";

    private static final Map<String, String> C_TYPES = Map.ofEntries(
            Map.entry("i8", "int8_t"),
            Map.entry("i16", "int16_t"),
            Map.entry("i32", "int32_t"),
            Map.entry("i64", "int64_t"),
            Map.entry("u8", "uint8_t"),
            Map.entry("u16", "uint16_t"),
            Map.entry("u32", "uint32_t"),
            Map.entry("u64", "uint64_t"),
            Map.entry("f32", "float"),
            Map.entry("f64", "double"),
            Map.entry("isize", "ptrdiff_t"),
            Map.entry("usize", "size_t"));

    /** Limits of the CZar integer types; unsigned minimums are plain zero. */
    private static final Map<String, String> C_CONSTANTS = Map.ofEntries(
            Map.entry("U8_MIN", "0"),
            Map.entry("U8_MAX", "UINT8_MAX"),
            Map.entry("U16_MIN", "0"),
            Map.entry("U16_MAX", "UINT16_MAX"),
            Map.entry("U32_MIN", "0"),
            Map.entry("U32_MAX", "UINT32_MAX"),
            Map.entry("U64_MIN", "0"),
            Map.entry("U64_MAX", "UINT64_MAX"),
            Map.entry("I8_MIN", "INT8_MIN"),
            Map.entry("I8_MAX", "INT8_MAX"),
            Map.entry("I16_MIN", "INT16_MIN"),
            Map.entry("I16_MAX", "INT16_MAX"),
            Map.entry("I32_MIN", "INT32_MIN"),
            Map.entry("I32_MAX", "INT32_MAX"),
            Map.entry("I64_MIN", "INT64_MIN"),
            Map.entry("I64_MAX", "INT64_MAX"),
            Map.entry("USIZE_MIN", "0"),
            Map.entry("USIZE_MAX", "SIZE_MAX"),
            Map.entry("ISIZE_MIN", "PTRDIFF_MIN"),
            Map.entry("ISIZE_MAX", "PTRDIFF_MAX"));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        int replaced = 0;
        int constants = 0;
        for (Token t : tokens.tokens()) {
            if (t.kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            String cType = C_TYPES.get(t.text());
            if (cType != null) {
                tokens.relabel(t, Keywords.isReserved(cType) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, cType);
                replaced++;
                continue;
            }
            String cConstant = C_CONSTANTS.get(t.text());
            if (cConstant != null) {
                tokens.relabel(t, cConstant.equals("0") ? TokenKind.NUMBER : TokenKind.IDENTIFIER, cConstant);
                constants++;
            }
        }
        log.debug("{}: replaced {} type names and {} constants", context.fileName(), replaced, constants);
    }
}
