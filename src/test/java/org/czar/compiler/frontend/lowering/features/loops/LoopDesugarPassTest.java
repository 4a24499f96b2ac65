package org.czar.compiler.frontend.lowering.features.loops;

import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests lowering of range and collection loops.
 */
public class LoopDesugarPassTest {

    @Test
    @Tag("unit")
    @DisplayName("Range loop with inclusive upper bound")
    void testRangeLoop() {
        // Arrange
        String source = "for (i32 i : 0..3) { }";

        // Act
        LoweringFixture.Result result = LoweringFixture.run(source, new LoopDesugarPass());

        // Assert
        assertThat(result.output()).isEqualTo("for (mut i32 i = 0; i <= 3; i++) { }");
        assertThat(result.diagnostics().diagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testRangeLoopKeepsExistingWritableMarker() {
        LoweringFixture.Result result = LoweringFixture.run("for (mut u8 k : lo..hi) { }", new LoopDesugarPass());

        assertThat(result.output()).isEqualTo("for (mut u8 k = lo; k <= hi; k++) { }");
    }

    @Test
    @Tag("unit")
    void testCollectionLoopBindsElement() {
        LoweringFixture.Result result = LoweringFixture.run("for (usize i, i32 v : arr) { }", new LoopDesugarPass());

        assertThat(result.output()).isEqualTo(
                "for (mut usize i = 0; i < sizeof(arr)/sizeof(arr[0]); i++) { i32 v = arr[i]; }");
    }

    @Test
    @Tag("unit")
    void testDiscardedIndexGetsGeneratedName() {
        LoweringFixture.Result result = LoweringFixture.run("for (_, i32 v : arr) { }", new LoopDesugarPass());

        assertThat(result.output()).isEqualTo(
                "for (mut size_t _cz_i0 = 0; _cz_i0 < sizeof(arr)/sizeof(arr[0]); _cz_i0++) { i32 v = arr[_cz_i0]; }");
    }

    @Test
    @Tag("unit")
    void testCompoundCollectionIsParenthesized() {
        LoweringFixture.Result result = LoweringFixture.run("for (usize i, i32 v : s.items) { }", new LoopDesugarPass());

        assertThat(result.output()).isEqualTo(
                "for (mut usize i = 0; i < sizeof((s.items))/sizeof((s.items)[0]); i++) { i32 v = (s.items)[i]; }");
    }

    @Test
    @Tag("unit")
    void testCollectionLoopWithoutBracesIsAnError() {
        LoweringFixture.Result result = LoweringFixture.run("for (usize i, i32 v : arr) sum += v;", new LoopDesugarPass());

        assertThat(result.errors()).containsExactly("Collection for-loop requires a braced body");
    }

    @Test
    @Tag("unit")
    void testClassicLoopIsUntouched() {
        String source = "for (mut i32 i = 0; i < n; i++) { x = c ? a : b; }";

        LoweringFixture.Result result = LoweringFixture.run(source, new LoopDesugarPass());

        assertThat(result.output()).isEqualTo(source);
    }
}
