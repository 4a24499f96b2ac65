package org.czar.compiler;

import org.czar.compiler.api.CompilationException;
import org.czar.compiler.diagnostics.DiagnosticsEngine;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.LoweringFixture;
import org.czar.compiler.frontend.lowering.LoweringPassRegistry;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests the pass driver and the default pipeline end to end.
 */
@ExtendWith(MockitoExtension.class)
public class TranspilerTest {

    @Mock
    private ILoweringPass first;

    @Mock
    private ILoweringPass second;

    @BeforeEach
    void setUp() {
        lenient().when(first.name()).thenReturn("first");
        lenient().when(second.name()).thenReturn("second");
    }

    private Transpiler transpilerWith(TranspilerOptions options, ILoweringPass... passes) {
        LoweringPassRegistry registry = new LoweringPassRegistry();
        for (ILoweringPass pass : passes) {
            registry.register(pass);
        }
        return new Transpiler(options, registry);
    }

    @Test
    @Tag("unit")
    void testPassesRunInRegistrationOrder() throws CompilationException {
        // Arrange
        Transpiler transpiler = transpilerWith(TranspilerOptions.defaults(), first, second);

        // Act
        transpiler.transpileSource("i32 x = 0;", "unit.cz");

        // Assert
        InOrder order = inOrder(first, second);
        order.verify(first).apply(any(), any());
        order.verify(second).apply(any(), any());
    }

    @Test
    @Tag("unit")
    void testDriverStopsAfterFirstFailingPass() {
        // Arrange
        doAnswer(invocation -> {
            CompilationContext context = invocation.getArgument(1);
            context.diagnostics().reportError("boom", 1);
            return null;
        }).when(first).apply(any(), any());
        Transpiler transpiler = transpilerWith(TranspilerOptions.defaults(), first, second);

        // Act & Assert
        assertThatThrownBy(() -> transpiler.transpileSource("i32 x = 0;", "unit.cz"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("[CZAR] ERROR at unit.cz:1: boom")
                .satisfies(e -> assertThat(((CompilationException) e).getDiagnostics()).hasSize(1));
        verify(second, never()).apply(any(), any());
    }

    @Test
    @Tag("unit")
    void testDisabledPassIsSkipped() throws CompilationException {
        Transpiler transpiler = transpilerWith(LoweringFixture.options("czar.passes.disabled = [second]"),
                first, second);

        transpiler.transpileSource("i32 x = 0;", "unit.cz");

        verify(first).apply(any(), any());
        verify(second, never()).apply(any(), any());
    }

    @Test
    @Tag("unit")
    void testLexerErrorsAbortBeforeAnyPass() {
        Transpiler transpiler = transpilerWith(TranspilerOptions.defaults(), first);

        assertThatThrownBy(() -> transpiler.transpileSource("char * s = \"open;\n", "unit.cz"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Unterminated string literal");
        verify(first, never()).apply(any(), any());
    }

    @Test
    @Tag("unit")
    void testDuplicatePassNamesAreRejected() {
        LoweringPassRegistry registry = new LoweringPassRegistry();
        registry.register(first);

        assertThatThrownBy(() -> registry.register(first)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    @DisplayName("Methods, structs, mutability, access and types lower together")
    void testDefaultPipelineEndToEnd() throws CompilationException {
        // Arrange
        String source = """
                struct Point { i32 x; i32 y; };
                void Point.move(i32 dx) { self.x = self.x + dx; }
                i32 main(void) {
                    mut Point p = {};
                    p.move(2);
                    return p.x;
                }
                """;
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("main.cz", source, true);

        // Act
        String output = new Transpiler(TranspilerOptions.defaults()).transpileSource(source, "main.cz", diagnostics);

        // Assert
        assertThat(output).isEqualTo("""
                typedef struct Point_s { int32_t x; int32_t y; } Point_t;
                typedef Point_t Point;
                void Point_move(Point * self, const int32_t dx) { self->x = self->x + dx; }
                int32_t main(void) {
                    Point p = {0};
                    Point_move(&p, 2);
                    return p.x;
                }
                """);
        assertThat(diagnostics.diagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDefaultPipelineReportsUninitializedLocal() {
        String source = "i32 main(void) {\n    i32 x;\n    return x;\n}\n";
        Transpiler transpiler = new Transpiler(TranspilerOptions.defaults());

        assertThatThrownBy(() -> transpiler.transpileSource(source, "main.cz"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("[CZAR] ERROR at main.cz:2: [in main()] Variable 'x' must be explicitly initialized")
                .hasMessageContaining("    > i32 x;");
    }

    @Test
    @Tag("unit")
    void testDefaultPipelineLowersLoopsAndCasts() throws CompilationException {
        String source = "void f(void) {\n    for (u8 i : 0..9) { u8 b = cast<u8>(i, 0); }\n}\n";

        String output = new Transpiler(TranspilerOptions.defaults()).transpileSource(source, "f.cz");

        assertThat(output).contains("for (uint8_t i = 0; i <= 9; i++)")
                .contains("const uint8_t b = ((i) > 255 || (i) < 0 ? (0) : (uint8_t)(i));");
    }

    @Test
    @Tag("unit")
    void testDefaultPipelineKeepsArithmeticAndMapsNames() throws CompilationException {
        String source = "i32 f(i32 a, i32 b) {\n    i32 r = a * b;\n    i32 _ = g(r);\n    return a * b + I32_MAX;\n}\n";

        String output = new Transpiler(TranspilerOptions.defaults()).transpileSource(source, "f.cz");

        assertThat(output).isEqualTo("int32_t f(const int32_t a, const int32_t b) {\n"
                + "    const int32_t r = a * b;\n"
                + "    const int32_t _unused_0 __attribute__((unused)) = g(r);\n"
                + "    return a * b + INT32_MAX;\n}\n");
    }
}
