package org.czar.compiler.frontend.semantics.analysis;

import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Registers {@code enum Name { A, B = expr }} definitions with their members in declaration
 * order and checks that member names are ALL_UPPERCASE.
 */
public class EnumSymbolCollector implements ISymbolCollector {

    private static final Pattern UPPER_CASE = Pattern.compile("[A-Z0-9_]+");

    @Override
    public void collect(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("enum")) {
                continue;
            }
            int nameIndex = tokens.nextSignificant(i + 1);
            if (nameIndex < 0 || tokens.get(nameIndex).kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            int open = tokens.nextSignificant(nameIndex + 1);
            if (open < 0 || !tokens.get(open).is("{")) {
                continue;
            }
            int close = tokens.findClosing(open);
            if (close < 0) {
                continue;
            }
            Token name = tokens.get(nameIndex);
            List<String> members = new ArrayList<>();
            for (SourceStructure.Range range : SourceStructure.splitTopLevel(tokens, open, close)) {
                int memberIndex = tokens.nextSignificant(range.start());
                if (memberIndex < 0 || memberIndex >= range.end()) {
                    continue;
                }
                Token member = tokens.get(memberIndex);
                if (member.kind() != TokenKind.IDENTIFIER) {
                    continue;
                }
                if (!UPPER_CASE.matcher(member.text()).matches()) {
                    context.diagnostics().report(context.options().enumCaseSeverity(),
                            "Enum value '" + member.text() + "' in enum '" + name.text()
                                    + "' must be ALL_UPPERCASE (e.g., " + member.text().toUpperCase(Locale.ROOT) + ")",
                            member.line());
                }
                members.add(member.text());
            }
            context.enums().register(name.text(), members, name.line());
            i = close;
        }
    }
}
