package org.czar.compiler.frontend.lowering.features.casts;

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
import java.util.Optional;

/**
 * Rejects C-style casts to integer types and lowers the {@code cast<T>(...)} form.
 * <pre>
 * cast&lt;u8&gt;(v)       becomes  (u8)(v)
 * cast&lt;u8&gt;(v, f)    becomes  ((v) &gt; 255 || (v) &lt; 0 ? (f) : (u8)(v))
 * </pre>
 * A two-argument cast to a type without known limits keeps only the value.
 */
public class CastLoweringPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(CastLoweringPass.class);

    public static final String NAME = "casts";

    private static final String CAST = "cast";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        rejectCStyleCasts(tokens, context);
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.kind() == TokenKind.IDENTIFIER && t.is(CAST)) {
                lowerCast(tokens, context, i);
            }
        }
    }

    private void rejectCStyleCasts(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("(")) {
                continue;
            }
            int type = tokens.nextSignificant(i + 1);
            if (type < 0 || !tokens.get(type).isWord() || !CastTypeTable.isKnownIntegerType(tokens.get(type).text())) {
                continue;
            }
            int close = tokens.nextSignificant(type + 1);
            while (close >= 0 && tokens.get(close).is("*")) {
                close = tokens.nextSignificant(close + 1);
            }
            if (close < 0 || !tokens.get(close).is(")")) {
                continue;
            }
            int operand = tokens.nextSignificant(close + 1);
            if (operand < 0) {
                continue;
            }
            Token o = tokens.get(operand);
            if (o.kind() == TokenKind.IDENTIFIER || o.kind() == TokenKind.NUMBER || o.is("(")) {
                String typeName = tokens.get(type).text();
                context.diagnostics().reportError("Unsafe C-style cast '(" + typeName + ")' is not allowed. Use cast<"
                        + typeName + ">(value[, fallback]) instead.", tokens.get(i).line());
            }
        }
    }

    private void lowerCast(TokenStream tokens, CompilationContext context, int castIndex) {
        Token cast = tokens.get(castIndex);
        int line = cast.line();
        int lt = tokens.nextSignificant(castIndex + 1);
        int type = lt < 0 ? -1 : tokens.nextSignificant(lt + 1);
        int gt = type < 0 ? -1 : tokens.nextSignificant(type + 1);
        if (lt < 0 || !tokens.get(lt).is("<") || type < 0 || !tokens.get(type).isWord()
                || gt < 0 || !tokens.get(gt).is(">")) {
            context.diagnostics().reportError("cast requires template syntax: cast<Type>(value)", line);
            return;
        }
        int open = tokens.nextSignificant(gt + 1);
        if (open < 0 || !tokens.get(open).is("(")) {
            context.diagnostics().reportError("cast requires function call syntax with parentheses", line);
            return;
        }
        int close = tokens.findClosing(open);
        if (close < 0) {
            context.diagnostics().reportError("cast requires function call syntax with parentheses", line);
            return;
        }
        List<SourceStructure.Range> args = SourceStructure.splitTopLevel(tokens, open, close);
        if (args.isEmpty() || args.size() > 2
                || args.stream().anyMatch(a -> !SourceStructure.hasSignificant(tokens, a.start(), a.end()))) {
            context.diagnostics().reportError("cast requires 1 or 2 arguments: cast<Type>(value[, fallback])", line);
            return;
        }
        String typeName = tokens.get(type).text();
        if (args.size() == 1) {
            context.diagnostics().reportWarning("cast<" + typeName + ">(value) without fallback. Consider the safer cast<"
                    + typeName + ">(value, fallback).", line);
            tokens.relabel(cast, TokenKind.PUNCTUATION, "(");
            tokens.blankRange(castIndex + 1, type);
            tokens.blankRange(type + 1, gt);
            tokens.relabel(tokens.get(gt), TokenKind.PUNCTUATION, ")");
            return;
        }

        List<Token> value = slice(tokens, args.get(0));
        List<Token> fallback = slice(tokens, args.get(1));
        TokenBuilder replacement = TokenBuilder.at(line);
        Optional<CastTypeTable.Bounds> bounds = CastTypeTable.boundsOf(typeName);
        if (bounds.isPresent()) {
            replacement.punct("(");
            parenthesized(replacement, value).space().op(">").space().number(bounds.get().max())
                    .space().op("||").space();
            parenthesized(replacement, value).space().op("<").space().number(bounds.get().min())
                    .space().op("?").space();
            parenthesized(replacement, fallback).space().op(":").space();
            replacement.punct("(").word(typeName).punct(")");
            parenthesized(replacement, value).punct(")");
        } else {
            log.debug("{}:{}: no limits known for '{}', fallback dropped", context.fileName(), line, typeName);
            replacement.punct("(").word(typeName).punct(")");
            parenthesized(replacement, value);
        }
        tokens.blankRange(castIndex, close + 1);
        tokens.insert(castIndex, replacement.build());
    }

    private List<Token> slice(TokenStream tokens, SourceStructure.Range range) {
        List<Integer> significant = SourceStructure.significantIndices(tokens, range.start(), range.end());
        return new ArrayList<>(tokens.tokens().subList(significant.get(0), significant.get(significant.size() - 1) + 1));
    }

    private TokenBuilder parenthesized(TokenBuilder builder, List<Token> expression) {
        return builder.punct("(").copyOf(expression).punct(")");
    }
}
