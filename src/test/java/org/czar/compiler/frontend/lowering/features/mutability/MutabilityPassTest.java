package org.czar.compiler.frontend.lowering.features.mutability;

import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests const synthesis and the writable marker rules.
 */
public class MutabilityPassTest {

    private LoweringFixture.Result lower(String source) {
        return LoweringFixture.run(source, new MutabilityPass());
    }

    @Test
    @Tag("unit")
    @DisplayName("Parameters are constant unless marked writable")
    void testValueParameterBecomesConst() {
        // Act
        LoweringFixture.Result result = lower("void f(i32 x, u8 y) { }");

        // Assert
        assertThat(result.output()).isEqualTo("void f(const i32 x, const u8 y) { }");
        assertThat(result.diagnostics().diagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testPointerParameterIsConstOnBothSides() {
        LoweringFixture.Result result = lower("void f(i32 * p);");

        assertThat(result.output()).isEqualTo("void f(const i32 * const p);");
    }

    @Test
    @Tag("unit")
    void testWritablePointerParameterIsStripped() {
        LoweringFixture.Result result = lower("void f(mut i32 * p) { }");

        assertThat(result.output()).isEqualTo("void f(i32 * p) { }");
    }

    @Test
    @Tag("unit")
    void testWritableValueParameterIsAnError() {
        LoweringFixture.Result result = lower("void f(mut i32 x) { }");

        assertThat(result.errors()).containsExactly(MutabilityPass.MUT_NON_POINTER_PARAMETER);
    }

    @Test
    @Tag("unit")
    void testLocalsBecomeConstUnlessWritable() {
        LoweringFixture.Result result = lower("void f(void) { i32 x = 0; mut i32 y = 1; i32 * p = 0; }");

        assertThat(result.output()).isEqualTo("void f(void) { const i32 x = 0; i32 y = 1; const i32 * const p = 0; }");
    }

    @Test
    @Tag("unit")
    @DisplayName("Multiplications are not mistaken for pointer declarations")
    void testMultiplicationIsNotADeclaration() {
        // Act
        LoweringFixture.Result result = lower("i32 f(i32 a, i32 b) { i32 r = a * b; return a * b; }");

        // Assert
        assertThat(result.output()).isEqualTo("i32 f(const i32 a, const i32 b) { const i32 r = a * b; return a * b; }");
        assertThat(result.diagnostics().diagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testMultiplicationInLoopConditionIsNotADeclaration() {
        LoweringFixture.Result result = lower("void f(i32 n, i32 m) { for (mut i32 i = 0; i < n * m; i++) { } }");

        assertThat(result.output()).isEqualTo("void f(const i32 n, const i32 m) { for (i32 i = 0; i < n * m; i++) { } }");
    }

    @Test
    @Tag("unit")
    void testGlobalsAndFieldsAreUntouched() {
        String source = "i32 limit = 4;\nstruct S { i32 v; };";

        LoweringFixture.Result result = lower(source);

        assertThat(result.output()).isEqualTo(source);
    }

    @Test
    @Tag("unit")
    void testSourceConstIsRejected() {
        LoweringFixture.Result result = lower("void f(void) { const i32 x = 0; }");

        assertThat(result.errors()).containsExactly(MutabilityPass.CONST_IN_SOURCE);
    }

    @Test
    @Tag("unit")
    void testWritableFieldIsRejected() {
        LoweringFixture.Result result = lower("struct S { mut i32 v; };");

        assertThat(result.errors()).containsExactly(MutabilityPass.MUT_STRUCT_FIELD);
    }

    @Test
    @Tag("unit")
    void testImmutableLoopCounterIsRejected() {
        LoweringFixture.Result result = lower("void f(void) { for (i32 i = 0; i < 3; i++) { } }");

        assertThat(result.errors()).containsExactly("For-loop counter 'i' must be mutable. Use: for (mut i32 i ...)");
    }

    @Test
    @Tag("unit")
    void testWritableLoopCounterIsAccepted() {
        LoweringFixture.Result result = lower("void f(void) { for (mut i32 i = 0; i < 3; i++) { } }");

        assertThat(result.output()).isEqualTo("void f(void) { for (i32 i = 0; i < 3; i++) { } }");
        assertThat(result.diagnostics().diagnostics()).isEmpty();
    }
}
