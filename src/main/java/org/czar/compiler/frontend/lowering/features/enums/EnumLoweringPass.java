package org.czar.compiler.frontend.lowering.features.enums;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.lowering.features.switches.SwitchStatement;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.frontend.semantics.EnumDefinition;
import org.czar.compiler.frontend.semantics.EnumRegistry;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Lowers enum member names and validates switches.
 * <p>
 * Members are emitted with their prefixed names ({@code RED} of {@code Color} becomes
 * {@code COLOR_RED}), and scoped references {@code Color.RED} are rewritten to match.
 * A switch whose subject is declared with an enum type must list every member; a switch
 * without a default receives {@code default: cz_unreachable("");}.
 */
public class EnumLoweringPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(EnumLoweringPass.class);

    public static final String NAME = "enums";

    static final String NON_ENUM_DEFAULT_MISSING = "Switch statement should have a default case. "
            + "Consider adding 'default: UNREACHABLE(\"\");' or appropriate handling.";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        EnumRegistry enums = context.enums();
        if (!enums.definitions().isEmpty()) {
            renameDeclarations(tokens, enums);
            rewriteScopedReferences(tokens, enums);
        }
        for (int i = 0; i < tokens.size(); i++) {
            Optional<SwitchStatement> statement = SwitchStatement.at(tokens, i);
            if (statement.isPresent()) {
                validateSwitch(tokens, context, statement.get());
            }
        }
    }

    private void renameDeclarations(TokenStream tokens, EnumRegistry enums) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("enum")) {
                continue;
            }
            int nameIndex = tokens.nextSignificant(i + 1);
            if (nameIndex < 0) {
                break;
            }
            Optional<EnumDefinition> definition = enums.find(tokens.get(nameIndex).text());
            int open = tokens.nextSignificant(nameIndex + 1);
            if (definition.isEmpty() || open < 0 || !tokens.get(open).is("{")) {
                continue;
            }
            int close = tokens.findClosing(open);
            if (close < 0) {
                continue;
            }
            for (SourceStructure.Range range : SourceStructure.splitTopLevel(tokens, open, close)) {
                int memberIndex = tokens.nextSignificant(range.start());
                if (memberIndex < 0 || memberIndex >= range.end()) {
                    continue;
                }
                Token member = tokens.get(memberIndex);
                definition.get().member(member.text()).ifPresent(m -> tokens.relabel(member, m.prefixedName()));
            }
            i = close;
        }
    }

    private void rewriteScopedReferences(TokenStream tokens, EnumRegistry enums) {
        for (int i = 0; i < tokens.size(); i++) {
            Token enumName = tokens.get(i);
            if (enumName.kind() != TokenKind.IDENTIFIER || !enums.contains(enumName.text())) {
                continue;
            }
            int dot = tokens.nextSignificant(i + 1);
            int memberIndex = dot < 0 ? -1 : tokens.nextSignificant(dot + 1);
            if (memberIndex < 0 || !tokens.get(dot).is(".")) {
                continue;
            }
            int prev = tokens.prevSignificant(i - 1);
            if (prev >= 0 && (tokens.get(prev).is(".") || tokens.get(prev).is("->"))) {
                continue;
            }
            Optional<EnumDefinition.Member> member = enums.find(enumName.text())
                    .flatMap(d -> d.member(tokens.get(memberIndex).text()));
            if (member.isPresent()) {
                tokens.blankRange(i + 1, memberIndex + 1);
                tokens.relabel(enumName, member.get().prefixedName());
            }
        }
    }

    private void validateSwitch(TokenStream tokens, CompilationContext context, SwitchStatement statement) {
        int line = tokens.get(statement.keyword()).line();
        Optional<EnumDefinition> subjectEnum = statement.subjectIdentifier(tokens)
                .flatMap(subject -> resolveEnumType(tokens, context.enums(), subject.text(), statement.keyword()));
        List<Integer> labels = statement.labels(tokens);
        boolean hasDefault = labels.stream().anyMatch(k -> tokens.get(k).is("default"));

        if (subjectEnum.isEmpty()) {
            if (!hasDefault) {
                context.diagnostics().reportWarning(NON_ENUM_DEFAULT_MISSING, line);
                synthesizeDefault(tokens, statement);
            }
            return;
        }

        EnumDefinition definition = subjectEnum.get();
        boolean[] covered = new boolean[definition.members().size()];
        for (int label : labels) {
            if (tokens.get(label).is("case")) {
                coverLabel(tokens, context, definition, label, covered);
            }
        }
        boolean complete = true;
        for (int m = 0; m < covered.length; m++) {
            if (!covered[m]) {
                complete = false;
                context.diagnostics().reportError("Non-exhaustive switch on enum '" + definition.name()
                        + "': missing case for '" + definition.members().get(m).name()
                        + "'. All enum values must be explicitly handled.", line);
            }
        }
        if (hasDefault || !complete) {
            return;
        }
        if (context.options().requireEnumDefault()) {
            context.diagnostics().reportError("Switch on enum '" + definition.name()
                    + "' must have a default case. Add 'default: UNREACHABLE()' if all cases are covered.", line);
        } else {
            log.debug("{}:{}: switch on enum '{}' covers every member, adding default", context.fileName(), line,
                    definition.name());
            synthesizeDefault(tokens, statement);
        }
    }

    private void coverLabel(TokenStream tokens, CompilationContext context, EnumDefinition definition, int label,
                            boolean[] covered) {
        int valueIndex = tokens.nextSignificant(label + 1);
        if (valueIndex < 0 || tokens.get(valueIndex).kind() != TokenKind.IDENTIFIER) {
            return;
        }
        Token value = tokens.get(valueIndex);
        int index = definition.indexOfAnySpelling(value.text());
        if (index < 0) {
            return;
        }
        covered[index] = true;
        EnumDefinition.Member member = definition.members().get(index);
        if (value.is(member.name())) {
            context.diagnostics().reportWarning("Unscoped enum constant '" + member.name()
                    + "' in switch. Prefer scoped syntax: 'case " + definition.name() + "." + member.name() + "'",
                    value.line());
            tokens.relabel(value, member.prefixedName());
        }
    }

    /**
     * Finds the nearest declaration of {@code variable} before {@code position}. Both
     * {@code enum Color c} and {@code Color c} count when {@code Color} is a known enum.
     */
    private Optional<EnumDefinition> resolveEnumType(TokenStream tokens, EnumRegistry enums, String variable,
                                                     int position) {
        for (int j = position - 1; j >= 0; j--) {
            Token t = tokens.get(j);
            if (t.kind() != TokenKind.IDENTIFIER || !t.is(variable)) {
                continue;
            }
            int typeIndex = tokens.prevSignificant(j - 1);
            if (typeIndex < 0) {
                continue;
            }
            Token type = tokens.get(typeIndex);
            if (type.kind() == TokenKind.IDENTIFIER && enums.contains(type.text())) {
                return enums.find(type.text());
            }
            if (Keywords.isPrimitiveType(type.text()) || type.is("*")) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private void synthesizeDefault(TokenStream tokens, SwitchStatement statement) {
        int line = tokens.get(statement.bodyClose()).line();
        tokens.insert(statement.bodyClose(), TokenBuilder.at(line)
                .whitespace("\n    ").word("default").op(":").space()
                .word("cz_unreachable").punct("(").string("\"\"").punct(")").punct(";")
                .whitespace("\n").build());
    }
}
