package org.czar.compiler.frontend.lowering.features.structs;

import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.czar.compiler.frontend.semantics.SymbolCollectionPass;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the zero-initializer rewrite.
 */
public class StructInitializerPassTest {

    private static final String POINT = "struct Point { i32 x; };\n";

    @Test
    @Tag("unit")
    void testEmptyBracesBecomeZeroInitializer() {
        LoweringFixture.Result result = LoweringFixture.run(POINT + "Point p = {};",
                new SymbolCollectionPass(), new StructInitializerPass());

        assertThat(result.output()).isEqualTo(POINT + "Point p = {0};");
    }

    @Test
    @Tag("unit")
    void testTypedEmptyInitializerDropsTheTypeName() {
        LoweringFixture.Result result = LoweringFixture.run(POINT + "Point p = Point {};",
                new SymbolCollectionPass(), new StructInitializerPass());

        assertThat(result.output()).isEqualTo(POINT + "Point p = {0};");
    }

    @Test
    @Tag("unit")
    void testNonEmptyInitializersAreKept() {
        String source = POINT + "Point p = { .x = 1 };\nPoint q = Point { 2 };";

        LoweringFixture.Result result = LoweringFixture.run(source,
                new SymbolCollectionPass(), new StructInitializerPass());

        assertThat(result.output()).isEqualTo(source);
    }

    @Test
    @Tag("unit")
    void testWhitespaceInsideEmptyBracesIsAccepted() {
        LoweringFixture.Result result = LoweringFixture.run("i32 a[4] = { };",
                new SymbolCollectionPass(), new StructInitializerPass());

        assertThat(result.output()).isEqualTo("i32 a[4] = {0 };");
    }
}
