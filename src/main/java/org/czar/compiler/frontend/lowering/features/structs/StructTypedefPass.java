package org.czar.compiler.frontend.lowering.features.structs;

import org.czar.compiler.frontend.lexer.TokenBuilder;
import org.czar.compiler.frontend.lowering.ILoweringPass;
import org.czar.compiler.frontend.semantics.CompilationContext;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Rewrites named struct definitions into a storage type with two public aliases.
 *
 * <pre>
 * struct Point { i32 x; };
 *   becomes
 * typedef struct Point_s { i32 x; } Point_t;
 * typedef Point_t Point;
 * </pre>
 *
 * A {@code struct} keyword already preceded by {@code typedef} is left alone, which makes the
 * pass idempotent. {@code struct Name x = ...} is a declaration, not a definition, because the
 * next significant token after the name is not an opening brace.
 * <p>
 * Once the tag of a definition is {@code Point_s}, every other {@code struct Point} in the
 * unit (forward declarations, locals, pointers) is relabeled to {@code struct Point_s} so
 * that it still names the defined type.
 */
public class StructTypedefPass implements ILoweringPass {

    private static final Logger log = LoggerFactory.getLogger(StructTypedefPass.class);

    public static final String NAME = "struct-typedef";

    /** Maximum distance between the struct name and its opening brace. */
    private static final int BRACE_LOOKAHEAD = 10;

    /** Maximum distance between the closing brace and the terminating semicolon. */
    private static final int SEMICOLON_LOOKAHEAD = 5;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(TokenStream tokens, CompilationContext context) {
        int lowered = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is("struct") && lowerAt(tokens, i)) {
                lowered++;
            }
        }
        int relabeled = relabelTagReferences(tokens);
        log.debug("{}: lowered {} struct definitions, relabeled {} tag references", context.fileName(), lowered,
                relabeled);
    }

    private int relabelTagReferences(TokenStream tokens) {
        Set<String> storageTags = new HashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            int nameIndex = tagNameAfter(tokens, i);
            if (nameIndex < 0) {
                continue;
            }
            int open = tokens.nextSignificant(nameIndex + 1);
            String tag = tokens.get(nameIndex).text();
            if (open >= 0 && tokens.get(open).is("{") && tag.endsWith("_s") && tag.length() > 2) {
                storageTags.add(tag);
            }
        }
        int relabeled = 0;
        for (int i = 0; i < tokens.size(); i++) {
            int nameIndex = tagNameAfter(tokens, i);
            if (nameIndex >= 0 && storageTags.contains(tokens.get(nameIndex).text() + "_s")) {
                tokens.relabel(tokens.get(nameIndex), tokens.get(nameIndex).text() + "_s");
                relabeled++;
            }
        }
        return relabeled;
    }

    /** @return The index of the tag name when {@code index} holds {@code struct}, otherwise -1. */
    private int tagNameAfter(TokenStream tokens, int index) {
        if (!tokens.get(index).is("struct")) {
            return -1;
        }
        int nameIndex = tokens.nextSignificant(index + 1);
        return nameIndex >= 0 && tokens.get(nameIndex).kind() == TokenKind.IDENTIFIER ? nameIndex : -1;
    }

    private boolean lowerAt(TokenStream tokens, int structIndex) {
        int prev = tokens.prevSignificant(structIndex - 1);
        if (prev >= 0 && tokens.get(prev).is("typedef")) {
            return false;
        }
        int nameIndex = tokens.nextSignificant(structIndex + 1);
        if (nameIndex < 0 || tokens.get(nameIndex).kind() != TokenKind.IDENTIFIER) {
            return false;
        }
        int open = tokens.nextSignificant(nameIndex + 1);
        if (open < 0 || open - nameIndex > BRACE_LOOKAHEAD || !tokens.get(open).is("{")) {
            return false;
        }
        int close = tokens.findClosing(open);
        if (close < 0) {
            return false;
        }
        int semicolon = tokens.nextSignificant(close + 1);
        if (semicolon < 0 || semicolon - close > SEMICOLON_LOOKAHEAD || !tokens.get(semicolon).is(";")) {
            return false;
        }

        Token name = tokens.get(nameIndex);
        String baseName = name.text().endsWith("_s") && name.text().length() > 2
                ? name.text().substring(0, name.text().length() - 2)
                : name.text();
        String aliasName = baseName + "_t";
        int line = name.line();

        // Edit back to front so the indices computed above stay valid
        tokens.insert(semicolon + 1, TokenBuilder.at(line)
                .whitespace("\n").word("typedef").space().word(aliasName).space().word(baseName).punct(";")
                .build());
        tokens.insert(semicolon, TokenBuilder.at(line).space().word(aliasName).build());
        tokens.relabel(name, baseName + "_s");
        tokens.insert(structIndex, TokenBuilder.at(line).word("typedef").space().build());
        return true;
    }
}
