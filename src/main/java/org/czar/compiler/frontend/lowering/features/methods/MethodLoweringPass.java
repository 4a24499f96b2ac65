package org.czar.compiler.frontend.lowering.features.methods;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.lowering.SourceStructure;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.frontend.semantics.StructMethodRegistry;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Lowers dotted method syntax into plain function declarations and calls.
 * <ul>
 *   <li>{@code void Point.move(i32 dx) {} } becomes {@code void Point_move(mut Point * self, i32 dx) {} }</li>
 *   <li>{@code Point.make(a)} becomes {@code Point_make(a)}</li>
 *   <li>{@code Log.info(msg)} becomes {@code cz_log_info(msg)}</li>
 *   <li>{@code p.move(dx)} becomes {@code Point_move(&p, dx)}</li>
 * </ul>
 * Instance calls resolve to the first struct, in declaration order, that declares the
 * method. The receiver of a method is always writable, so it is declared with the
 * writable marker that the mutability pass strips later.
 */
public class MethodLoweringPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(MethodLoweringPass.class);

    public static final String NAME = "methods";

    /** Name of the receiver parameter inserted into method declarations. */
    public static final String SELF = "self";

    /**
     * Positions of a {@code receiver . method (} pattern.
     */
    private record MethodSite(int receiver, int method, int open, int close) {
    }

    @Override
    public String name() {
        return NAME;
    }

    /** Runtime flag read by the {@code cz_log_*} functions; set by {@code #pragma czar debug}. */
    static final String DEBUG_MODE_FLAG = "cz_log_debug_mode";

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        lowerDeclarations(tokens, context);
        if (lowerCalls(tokens, context)) {
            declareDebugModeFlag(tokens, context);
        }
    }

    private void declareDebugModeFlag(TokenStream tokens, CompilationContext context) {
        tokens.insert(0, TokenBuilder.at(1)
                .word("static").space().word("int").space().word(DEBUG_MODE_FLAG).space().op("=").space()
                .number(context.isDebugMode() ? "1" : "0").punct(";").whitespace("\n")
                .build());
    }

    private void lowerDeclarations(TokenStream tokens, CompilationContext context) {
        for (int i = 0; i < tokens.size(); i++) {
            Token receiver = tokens.get(i);
            if (receiver.kind() != TokenKind.IDENTIFIER || !context.structTypes().contains(receiver.text())) {
                continue;
            }
            Optional<MethodSite> site = matchSite(tokens, i);
            if (site.isEmpty() || !isDeclaration(tokens, site.get())) {
                continue;
            }
            MethodSite s = site.get();
            String structName = receiver.text();
            String methodName = tokens.get(s.method()).text();

            List<SourceStructure.Range> params = SourceStructure.splitTopLevel(tokens, s.open(), s.close());
            boolean hasParams = !params.isEmpty();
            if (params.size() == 1 && isVoid(tokens, params.get(0))) {
                tokens.blankRange(params.get(0).start(), params.get(0).end());
                hasParams = false;
            }

            TokenBuilder self = TokenBuilder.at(receiver.line())
                    .word(Keywords.MUT).space().word(structName).space().op("*").space().word(SELF);
            if (hasParams) {
                self.punct(",").space();
            }
            tokens.insert(s.open() + 1, self.build());
            tokens.blankRange(i + 1, s.method() + 1);
            tokens.relabel(receiver, structName + "_" + methodName);
            log.debug("{}:{}: lowered method declaration {}.{}", context.fileName(), receiver.line(), structName, methodName);
        }
    }

    /** @return true if a call to the built-in Log facility was lowered. */
    private boolean lowerCalls(TokenStream tokens, CompilationContext context) {
        StructMethodRegistry methods = context.structMethods();
        boolean usesLog = false;
        for (int i = 0; i < tokens.size(); i++) {
            Token receiver = tokens.get(i);
            if (receiver.kind() != TokenKind.IDENTIFIER) {
                continue;
            }
            Optional<MethodSite> site = matchSite(tokens, i);
            if (site.isEmpty() || isDeclaration(tokens, site.get()) || isMemberOfExpression(tokens, i)) {
                continue;
            }
            MethodSite s = site.get();
            String receiverName = receiver.text();
            String methodName = tokens.get(s.method()).text();

            if (StructMethodRegistry.LOG_STRUCT.equals(receiverName) && methods.contains(receiverName, methodName)) {
                rewriteCallee(tokens, s, "cz_log_" + methodName);
                usesLog = true;
            } else if (context.structTypes().contains(receiverName)) {
                if (methods.contains(receiverName, methodName)) {
                    rewriteCallee(tokens, s, receiverName + "_" + methodName);
                }
            } else {
                List<String> owners = methods.owners(methodName);
                if (owners.isEmpty()) {
                    continue;
                }
                if (owners.size() > 1) {
                    log.debug("{}:{}: method '{}' is declared on {}; resolving '{}.{}' to {}", context.fileName(),
                            receiver.line(), methodName, owners, receiverName, methodName, owners.get(0));
                }
                boolean hasArgs = SourceStructure.hasSignificant(tokens, s.open() + 1, s.close());
                TokenBuilder self = TokenBuilder.at(receiver.line());
                if (!isPointerParameter(tokens, i, receiverName)) {
                    self.op("&");
                }
                self.word(receiverName);
                if (hasArgs) {
                    self.punct(",").space();
                }
                tokens.insert(s.open() + 1, self.build());
                rewriteCallee(tokens, s, owners.get(0) + "_" + methodName);
            }
        }
        return usesLog;
    }

    private void rewriteCallee(TokenStream tokens, MethodSite site, String functionName) {
        tokens.blankRange(site.receiver() + 1, site.method() + 1);
        tokens.relabel(tokens.get(site.receiver()), TokenKind.IDENTIFIER, functionName);
    }

    private Optional<MethodSite> matchSite(TokenStream tokens, int receiver) {
        int dot = tokens.nextSignificant(receiver + 1);
        if (dot < 0 || !tokens.get(dot).is(".")) {
            return Optional.empty();
        }
        int method = tokens.nextSignificant(dot + 1);
        if (method < 0 || tokens.get(method).kind() != TokenKind.IDENTIFIER) {
            return Optional.empty();
        }
        int open = tokens.nextSignificant(method + 1);
        if (open < 0 || !tokens.get(open).is("(")) {
            return Optional.empty();
        }
        int close = tokens.findClosing(open);
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(new MethodSite(receiver, method, open, close));
    }

    private boolean isDeclaration(TokenStream tokens, MethodSite site) {
        int body = tokens.nextSignificant(site.close() + 1);
        return body >= 0 && tokens.get(body).is("{");
    }

    /** {@code a.b.method()} and {@code a->b.method()} have a receiver that is not a plain identifier. */
    private boolean isMemberOfExpression(TokenStream tokens, int receiver) {
        int prev = tokens.prevSignificant(receiver - 1);
        return prev >= 0 && (tokens.get(prev).is(".") || tokens.get(prev).is("->"));
    }

    private boolean isVoid(TokenStream tokens, SourceStructure.Range range) {
        List<Integer> significant = SourceStructure.significantIndices(tokens, range.start(), range.end());
        return significant.size() == 1 && tokens.get(significant.get(0)).is("void");
    }

    /**
     * Checks whether {@code name} is a pointer parameter of the function enclosing
     * {@code index}; such a receiver is passed as is instead of by address.
     */
    private boolean isPointerParameter(TokenStream tokens, int index, String name) {
        List<Integer> braces = SourceStructure.enclosingBraces(tokens, index);
        if (braces.isEmpty()) {
            return false;
        }
        int functionBrace = braces.get(braces.size() - 1);
        if (SourceStructure.blockKind(tokens, functionBrace) != SourceStructure.BlockKind.FUNCTION) {
            return false;
        }
        int close = tokens.prevSignificant(functionBrace - 1);
        int open = tokens.findEnclosingOpen(close, "(");
        for (SourceStructure.Range param : SourceStructure.splitTopLevel(tokens, open, close)) {
            List<Integer> significant = SourceStructure.significantIndices(tokens, param.start(), param.end());
            if (significant.size() >= 2) {
                Token last = tokens.get(significant.get(significant.size() - 1));
                Token beforeLast = tokens.get(significant.get(significant.size() - 2));
                if (last.is(name) && beforeLast.is("*")) {
                    return true;
                }
            }
        }
        return false;
    }
}
