package org.czar.compiler.frontend.lowering.features.enums;

import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.czar.compiler.frontend.semantics.SymbolCollectionPass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests enum renaming and switch exhaustiveness.
 */
public class EnumLoweringPassTest {

    private static final String COLOR = "enum Color { RED, GREEN };\n";

    private LoweringFixture.Result lower(String source) {
        return LoweringFixture.run(source, new SymbolCollectionPass(), new EnumLoweringPass());
    }

    private String switchOver(String cases) {
        return COLOR + "void f(Color c) {\n    switch (c) {\n" + cases + "    }\n}\n";
    }

    @Test
    @Tag("unit")
    void testMembersAndScopedReferencesArePrefixed() {
        // Act
        LoweringFixture.Result result = lower(COLOR + "Color c = Color.GREEN;");

        // Assert
        assertThat(result.output()).isEqualTo("enum Color { COLOR_RED, COLOR_GREEN };\nColor c = COLOR_GREEN;");
    }

    @Test
    @Tag("unit")
    @DisplayName("An exhaustive enum switch still needs a default")
    void testExhaustiveSwitchWithoutDefaultIsAnError() {
        LoweringFixture.Result result = lower(switchOver(
                "        case Color.RED: break;\n        case Color.GREEN: break;\n"));

        assertThat(result.errors()).containsExactly("Switch on enum 'Color' must have a default case. "
                + "Add 'default: UNREACHABLE()' if all cases are covered.");
        assertThat(result.output()).doesNotContain("cz_unreachable");
    }

    @Test
    @Tag("unit")
    void testMissingMemberIsAnError() {
        LoweringFixture.Result result = lower(switchOver("        case Color.RED: break;\n"));

        assertThat(result.errors()).containsExactly("Non-exhaustive switch on enum 'Color': missing case for 'GREEN'. "
                + "All enum values must be explicitly handled.");
    }

    @Test
    @Tag("unit")
    void testDefaultDoesNotExcuseMissingMember() {
        LoweringFixture.Result result = lower(switchOver(
                "        case Color.RED: break;\n        default: break;\n"));

        assertThat(result.errors()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testUnscopedLabelWarnsAndIsPrefixed() {
        LoweringFixture.Result result = lower(switchOver(
                "        case RED: break;\n        case Color.GREEN: break;\n        default: break;\n"));

        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).containsExactly(
                "Unscoped enum constant 'RED' in switch. Prefer scoped syntax: 'case Color.RED'");
        assertThat(result.output()).contains("case COLOR_RED: break;");
    }

    @Test
    @Tag("unit")
    void testRelaxedPolicySynthesizesDefault() {
        LoweringFixture.Result result = LoweringFixture.run(
                LoweringFixture.options("czar.switch.require-enum-default = false"),
                switchOver("        case Color.RED: break;\n        case Color.GREEN: break;\n"),
                new SymbolCollectionPass(), new EnumLoweringPass());

        assertThat(result.diagnostics().diagnostics()).isEmpty();
        assertThat(result.output())
                .contains("case COLOR_RED: break;")
                .contains("default: cz_unreachable(\"\");");
    }

    @Test
    @Tag("unit")
    void testNonEnumSwitchWithoutDefaultWarns() {
        String source = "void f(i32 n) {\n    switch (n) {\n        case 1: break;\n    }\n}\n";

        LoweringFixture.Result result = lower(source);

        assertThat(result.warnings()).containsExactly(EnumLoweringPass.NON_ENUM_DEFAULT_MISSING);
        assertThat(result.output()).contains("default: cz_unreachable(\"\");");
    }

    @Test
    @Tag("unit")
    void testSwitchWithDefaultIsLeftAlone() {
        String source = "void f(i32 n) {\n    switch (n) {\n        case 1: break;\n        default: break;\n    }\n}\n";

        LoweringFixture.Result result = lower(source);

        assertThat(result.output()).isEqualTo(source);
        assertThat(result.diagnostics().diagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testNestedSwitchLabelsBelongToTheirOwnSwitch() {
        LoweringFixture.Result result = lower(switchOver("""
                        case Color.RED:
                            switch (c) { case Color.RED: break; default: break; }
                            break;
                        case Color.GREEN: break;
                """));

        assertThat(result.errors()).containsExactly("Non-exhaustive switch on enum 'Color': missing case for 'GREEN'. "
                + "All enum values must be explicitly handled.");
    }
}
