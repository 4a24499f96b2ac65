package org.czar.compiler.frontend.lowering.features.switches;

import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the explicit control flow rule for switch cases.
 */
public class SwitchControlFlowPassTest {

    private LoweringFixture.Result check(String body) {
        return LoweringFixture.run("void f(i32 n) {\n" + body + "\n}\n", new SwitchControlFlowPass());
    }

    @Test
    @Tag("unit")
    void testCaseWithoutControlFlowIsAnError() {
        // Act
        LoweringFixture.Result result = check("switch (n) {\ncase 1: g();\ncase 2: break;\ndefault: break;\n}");

        // Assert
        assertThat(result.errors()).containsExactly(SwitchControlFlowPass.MISSING_CONTROL_FLOW);
        assertThat(result.diagnostics().diagnostics().get(0).line()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testEveryControlKeywordIsAccepted() {
        LoweringFixture.Result result = check("""
                switch (n) {
                case 1: return;
                case 2: goto done;
                case 3: UNREACHABLE("x");
                case 4: if (n) { break; } else { return; }
                default: TODO("later");
                }
                done: ;""");

        assertThat(result.errors()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testEmptyCasesMayStack() {
        LoweringFixture.Result result = check("switch (n) {\ncase 1:\ncase 2: { }\ncase 3: break;\n}");

        assertThat(result.errors()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testContinueInSwitchBecomesFallthrough() {
        LoweringFixture.Result result = check("switch (n) {\ncase 1: g(); continue;\ncase 2: break;\n}");

        assertThat(result.errors()).isEmpty();
        assertThat(result.output()).contains("case 1: g(); __attribute__((fallthrough));");
    }

    @Test
    @Tag("unit")
    void testContinueInsideLoopIsKept() {
        LoweringFixture.Result result = check(
                "switch (n) {\ncase 1: while (n) { continue; } break;\ndefault: break;\n}");

        assertThat(result.output()).contains("while (n) { continue; }");
    }

    @Test
    @Tag("unit")
    void testContinueOfEnclosingLoopIsKept() {
        LoweringFixture.Result result = check(
                "for (mut i32 i = 0; i < n; i++) {\nswitch (i) {\ncase 1: continue;\ndefault: break;\n}\n}");

        assertThat(result.output()).contains("case 1: continue;");
    }

    @Test
    @Tag("unit")
    void testSwitchStatementFindsItsOwnLabels() {
        // Arrange
        LoweringFixture.Result result = check(
                "switch (n) {\ncase 1: switch (n) { case 5: break; } break;\ndefault: break;\n}");
        int keyword = 0;
        while (!result.tokens().get(keyword).is("switch")) {
            keyword++;
        }

        // Act
        SwitchStatement statement = SwitchStatement.at(result.tokens(), keyword).orElseThrow();

        // Assert
        assertThat(statement.labels(result.tokens()))
                .extracting(k -> result.tokens().get(k).text())
                .containsExactly("case", "default");
        assertThat(statement.hasDefault(result.tokens())).isTrue();
        assertThat(statement.subjectIdentifier(result.tokens())).map(t -> t.text()).contains("n");
    }
}
