package org.czar.compiler.frontend.lowering.features.loops;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers range and collection {@code for} loops into counted C loops.
 *
 * <pre>
 * for (i32 i : 0..3) {}            becomes  for (mut i32 i = 0; i &lt;= 3; i++) {}
 * for (usize i, i32 v : arr) {}    becomes  for (mut usize i = 0; i &lt; sizeof(arr)/sizeof(arr[0]); i++) { i32 v = arr[i]; }
 * for (_, i32 v : arr) {}          uses a generated index name
 * </pre>
 *
 * The induction variable is always writable, so the writable marker is inserted when the
 * source omits it.
 */
public class LoopDesugarPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(LoopDesugarPass.class);

    public static final String NAME = "loops";

    private static final String RANGE = "..";
    private static final String DISCARD = "_";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("for")) {
                continue;
            }
            int open = tokens.nextSignificant(i + 1);
            if (open < 0 || !tokens.get(open).is("(")) {
                continue;
            }
            int close = tokens.findClosing(open);
            if (close < 0) {
                continue;
            }
            int colon = findHeaderColon(tokens, open, close);
            if (colon < 0) {
                continue;
            }
            int range = findTopLevel(tokens, colon + 1, close, RANGE);
            if (range >= 0) {
                lowerRange(tokens, open, colon, range, close);
            } else {
                lowerCollection(tokens, context, open, colon, close);
            }
        }
    }

    private void lowerRange(TokenStream tokens, int open, int colon, int range, int close) {
        List<Integer> declaration = SourceStructure.significantIndices(tokens, open + 1, colon);
        if (declaration.size() < 2) {
            return;
        }
        Token variable = tokens.get(declaration.get(declaration.size() - 1));
        int line = variable.line();
        String name = variable.text();

        // Back to front so earlier indices stay valid
        tokens.insert(close, TokenBuilder.at(line).punct(";").space().word(name).op("++").build());
        tokens.blank(tokens.get(range));
        tokens.insert(range, TokenBuilder.at(line).punct(";").space().word(name).space().op("<=").space().build());
        tokens.relabel(tokens.get(colon), TokenKind.OPERATOR, "=");
        Token first = tokens.get(declaration.get(0));
        if (!first.is(Keywords.MUT)) {
            tokens.insert(declaration.get(0), TokenBuilder.at(line).word(Keywords.MUT).space().build());
        }
    }

    private void lowerCollection(TokenStream tokens, CompilationContext context, int open, int colon, int close) {
        List<SourceStructure.Range> bindings = splitBindings(tokens, open + 1, colon);
        if (bindings.size() != 2) {
            return;
        }
        List<Integer> index = SourceStructure.significantIndices(tokens, bindings.get(0).start(), bindings.get(0).end());
        List<Integer> value = SourceStructure.significantIndices(tokens, bindings.get(1).start(), bindings.get(1).end());
        if (index.isEmpty() || value.size() < 2) {
            return;
        }
        int body = tokens.nextSignificant(close + 1);
        Token forToken = tokens.get(open);
        int line = forToken.line();
        if (body < 0 || !tokens.get(body).is("{")) {
            context.diagnostics().reportError("Collection for-loop requires a braced body", line);
            return;
        }

        String indexName;
        List<Token> indexType = new ArrayList<>();
        if (index.size() == 1 && tokens.get(index.get(0)).is(DISCARD)) {
            indexName = context.generateName("i");
            indexType.add(new Token(TokenKind.IDENTIFIER, "size_t", line, 0));
        } else {
            indexName = tokens.get(index.get(index.size() - 1)).text();
            for (int k = 0; k < index.size() - 1; k++) {
                Token t = tokens.get(index.get(k));
                if (!t.is(Keywords.MUT)) {
                    indexType.add(t);
                }
            }
        }

        List<Token> collection = new ArrayList<>();
        for (int k : SourceStructure.significantIndices(tokens, colon + 1, close)) {
            collection.add(tokens.get(k));
        }
        List<Token> valueDeclaration = new ArrayList<>();
        for (int k : value) {
            valueDeclaration.add(tokens.get(k));
        }
        String valueName = valueDeclaration.remove(valueDeclaration.size() - 1).text();

        TokenBuilder binding = TokenBuilder.at(line).space();
        appendSpaced(binding, valueDeclaration);
        binding.space().word(valueName).space().op("=").space();
        appendParenthesized(binding, collection);
        binding.punct("[").word(indexName).punct("]").punct(";");
        tokens.insert(body + 1, binding.build());

        TokenBuilder header = TokenBuilder.at(line).word(Keywords.MUT).space();
        appendSpaced(header, indexType);
        header.space().word(indexName).space().op("=").space().number("0").punct(";").space()
                .word(indexName).space().op("<").space()
                .word("sizeof").punct("(");
        appendParenthesized(header, collection);
        header.punct(")").op("/").word("sizeof").punct("(");
        appendParenthesized(header, collection);
        header.punct("[").number("0").punct("]").punct(")").punct(";").space()
                .word(indexName).op("++");
        tokens.blankRange(open + 1, close);
        tokens.insert(open + 1, header.build());
        log.debug("{}:{}: lowered collection loop binding '{}' with index '{}'", context.fileName(), line,
                valueName, indexName);
    }

    private void appendSpaced(TokenBuilder builder, List<Token> source) {
        for (int k = 0; k < source.size(); k++) {
            if (k > 0) {
                builder.space();
            }
            builder.copyOf(List.of(source.get(k)));
        }
    }

    /** Single-token collections are used as is; longer expressions are parenthesized. */
    private void appendParenthesized(TokenBuilder builder, List<Token> expression) {
        if (expression.size() == 1) {
            builder.copyOf(expression);
        } else {
            builder.punct("(").copyOf(expression).punct(")");
        }
    }

    /** Finds a top-level {@code :} in a for header that has no {@code ;}. */
    private int findHeaderColon(TokenStream tokens, int open, int close) {
        if (findTopLevel(tokens, open + 1, close, ";") >= 0) {
            return -1;
        }
        return findTopLevel(tokens, open + 1, close, ":");
    }

    private int findTopLevel(TokenStream tokens, int from, int to, String text) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.kind() == TokenKind.PUNCTUATION) {
                if (t.is("(") || t.is("[") || t.is("{")) {
                    depth++;
                } else if (t.is(")") || t.is("]") || t.is("}")) {
                    depth--;
                }
            }
            if (depth == 0 && t.is(text)) {
                return i;
            }
        }
        return -1;
    }

    private List<SourceStructure.Range> splitBindings(TokenStream tokens, int from, int to) {
        List<SourceStructure.Range> ranges = new ArrayList<>();
        int start = from;
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.is("(") || t.is("[")) {
                depth++;
            } else if (t.is(")") || t.is("]")) {
                depth--;
            } else if (depth == 0 && t.is(",")) {
                ranges.add(new SourceStructure.Range(start, i));
                start = i + 1;
            }
        }
        ranges.add(new SourceStructure.Range(start, to));
        return ranges;
    }
}
