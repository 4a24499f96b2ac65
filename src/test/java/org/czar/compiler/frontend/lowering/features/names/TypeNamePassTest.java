package org.czar.compiler.frontend.lowering.features.names;

import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the primitive type and limit constant mappings.
 */
public class TypeNamePassTest {

    @Test
    @Tag("unit")
    void testTypeNamesAreMapped() {
        // Act
        LoweringFixture.Result result = LoweringFixture.run(
                "u8 a; i64 b; f32 c; f64 d; usize e; isize f; bool g;", new TypeNamePass());

        // Assert
        assertThat(result.output()).isEqualTo(
                "uint8_t a; int64_t b; float c; double d; size_t e; ptrdiff_t f; bool g;");
    }

    @Test
    @Tag("unit")
    void testTypeNamesInStringsAndCommentsAreKept() {
        String source = "char * s = \"i32\"; /* u8 */";

        LoweringFixture.Result result = LoweringFixture.run(source, new TypeNamePass());

        assertThat(result.output()).isEqualTo(source);
    }

    @Test
    @Tag("unit")
    void testLimitConstantsAreMapped() {
        LoweringFixture.Result result = LoweringFixture.run(
                "u8 m = U8_MAX; usize n = USIZE_MAX; i32 lo = I32_MIN; u16 z = U16_MIN; isize p = ISIZE_MAX;",
                new TypeNamePass());

        assertThat(result.output()).isEqualTo("uint8_t m = UINT8_MAX; size_t n = SIZE_MAX; int32_t lo = INT32_MIN; "
                + "uint16_t z = 0; ptrdiff_t p = PTRDIFF_MAX;");
    }

    @Test
    @Tag("unit")
    void testUnknownUppercaseNamesAreKept() {
        String source = "i32 x = U128_MAX + MY_MAX;";

        LoweringFixture.Result result = LoweringFixture.run(source, new TypeNamePass());

        assertThat(result.output()).isEqualTo("int32_t x = U128_MAX + MY_MAX;");
    }
}
