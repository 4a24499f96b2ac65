package org.czar.compiler.frontend.lowering.features.structs;

import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.czar.compiler.frontend.semantics.SymbolCollectionPass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the struct definition to typedef rewrite.
 */
public class StructTypedefPassTest {

    @Test
    @Tag("unit")
    void testNamedStructBecomesTypedefWithAlias() {
        // Arrange
        String source = "struct Point { i32 x; i32 y; };";

        // Act
        LoweringFixture.Result result = LoweringFixture.run(source, new StructTypedefPass());

        // Assert
        assertThat(result.output()).isEqualTo(
                "typedef struct Point_s { i32 x; i32 y; } Point_t;\ntypedef Point_t Point;");
    }

    @Test
    @Tag("unit")
    void testPassIsIdempotent() {
        String source = "struct Point { i32 x; };";
        String once = LoweringFixture.run(source, new StructTypedefPass()).output();

        String twice = LoweringFixture.run(once, new StructTypedefPass()).output();

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @Tag("unit")
    void testStructDeclarationsAreUntouched() {
        String source = "struct Point * p = 0;\nvoid f(struct Point q);";

        LoweringFixture.Result result = LoweringFixture.run(source, new StructTypedefPass());

        assertThat(result.output()).isEqualTo(source);
    }

    @Test
    @Tag("unit")
    @DisplayName("Tag references to a lowered struct follow the renamed tag")
    void testTagReferencesAreRelabeled() {
        // Arrange
        String source = "struct P;\nstruct P { i32 x; };\nvoid f(void) { struct P q = {0}; struct P * r = &q; }";

        // Act
        LoweringFixture.Result result = LoweringFixture.run(source, new StructTypedefPass());

        // Assert
        assertThat(result.output()).isEqualTo("struct P_s;\ntypedef struct P_s { i32 x; } P_t;\ntypedef P_t P;\n"
                + "void f(void) { struct P_s q = {0}; struct P_s * r = &q; }");
    }

    @Test
    @Tag("unit")
    void testTagReferencesAreRelabeledOnlyOnce() {
        String source = "struct P { i32 x; };\nstruct P * head;";
        String once = LoweringFixture.run(source, new StructTypedefPass()).output();

        String twice = LoweringFixture.run(once, new StructTypedefPass()).output();

        assertThat(once).endsWith("struct P_s * head;");
        assertThat(twice).isEqualTo(once);
    }

    @Test
    @Tag("unit")
    void testStorageSuffixIsNotDoubled() {
        LoweringFixture.Result result = LoweringFixture.run("struct Node_s { i32 v; };", new StructTypedefPass());

        assertThat(result.output()).isEqualTo("typedef struct Node_s { i32 v; } Node_t;\ntypedef Node_t Node;");
    }

    @Test
    @Tag("unit")
    void testTypedefOutputIsStillCollectedAsTheLogicalName() {
        String lowered = LoweringFixture.run("struct Point { i32 x; };", new StructTypedefPass()).output();

        LoweringFixture.Result result = LoweringFixture.run(lowered, new SymbolCollectionPass());

        assertThat(result.context().structTypes().names()).containsExactly("Point");
    }
}
