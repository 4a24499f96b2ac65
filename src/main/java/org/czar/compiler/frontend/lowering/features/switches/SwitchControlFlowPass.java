package org.czar.compiler.frontend.lowering.features.switches;

import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Requires every non-empty case to end its control flow explicitly and turns
 * {@code continue} into an explicit fallthrough where it cannot mean a loop continue.
 */
public class SwitchControlFlowPass implements ILoweringPass {

    public static final String NAME = "switch-control-flow";

    static final String FALLTHROUGH = "__attribute__((fallthrough))";

    static final String MISSING_CONTROL_FLOW = "Switch case must have explicit control flow. Use 'break' to end case, "
            + "'continue' for fallthrough, or 'return'/'goto' for other control flow.";

    private static final Set<String> CONTROL_FLOW = Set.of(
            "break", "continue", "return", "goto",
            "UNREACHABLE", "TODO", "FIXME", "cz_unreachable", "cz_todo", "cz_fixme");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            Optional<SwitchStatement> statement = SwitchStatement.at(tokens, i);
            statement.ifPresent(s -> checkCases(tokens, context, s));
        }
        for (Token t : tokens.tokens()) {
            if (t.kind() == TokenKind.KEYWORD && t.is("continue") && isSwitchContinue(tokens, tokens.indexOf(t))) {
                tokens.relabel(t, TokenKind.IDENTIFIER, FALLTHROUGH);
            }
        }
    }

    private void checkCases(TokenStream tokens, CompilationContext context, SwitchStatement statement) {
        List<Integer> labels = statement.labels(tokens);
        for (int n = 0; n < labels.size(); n++) {
            int label = labels.get(n);
            int colon = findLabelColon(tokens, label, statement.bodyClose());
            if (colon < 0) {
                continue;
            }
            int end = n + 1 < labels.size() ? labels.get(n + 1) : statement.bodyClose();
            if (!isEmptyBody(tokens, colon + 1, end) && !hasControlFlow(tokens, colon + 1, end)) {
                context.diagnostics().reportError(MISSING_CONTROL_FLOW, tokens.get(label).line());
            }
        }
    }

    private int findLabelColon(TokenStream tokens, int label, int limit) {
        for (int i = label + 1; i < limit; i++) {
            if (tokens.get(i).is(":")) {
                return i;
            }
        }
        return -1;
    }

    private boolean isEmptyBody(TokenStream tokens, int from, int to) {
        for (int i : SourceStructure.significantIndices(tokens, from, to)) {
            Token t = tokens.get(i);
            if (!t.is(";") && !t.is("{") && !t.is("}")) {
                return false;
            }
        }
        return true;
    }

    private boolean hasControlFlow(TokenStream tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.isWord() && CONTROL_FLOW.contains(t.text())) {
                return true;
            }
        }
        return false;
    }

    /** A continue whose innermost breakable construct is a switch that no loop encloses. */
    private boolean isSwitchContinue(TokenStream tokens, int index) {
        boolean inSwitch = false;
        for (int brace : SourceStructure.enclosingBraces(tokens, index)) {
            SourceStructure.BlockKind kind = SourceStructure.blockKind(tokens, brace);
            if (kind == SourceStructure.BlockKind.LOOP) {
                return false;
            }
            if (kind == SourceStructure.BlockKind.SWITCH) {
                inSwitch = true;
            }
        }
        return inSwitch;
    }
}
