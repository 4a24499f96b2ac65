package org.czar.compiler.frontend.lowering;

import org.czar.compiler.frontend.lexer.Keywords;
import org.czar.compiler.model.Token;
import org.czar.compiler.model.TokenKind;
import org.czar.compiler.model.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Nesting queries over a flat token stream. Nothing is cached: every query rescans the
 * stream, so answers stay correct after insertions made by the calling pass.
 */
public final class SourceStructure {

    /**
     * What a brace-delimited block belongs to.
     */
    public enum BlockKind {
        /** Body of a struct, union or enum definition. */
        AGGREGATE,
        /** Body of a function definition. */
        FUNCTION,
        /** Body of a for, while or do loop. */
        LOOP,
        /** Body of a switch statement. */
        SWITCH,
        /** Any other block: if/else bodies, initializer lists, bare blocks. */
        OTHER
    }

    /**
     * A half-open token index range.
     * @param start First index, inclusive.
     * @param end   Last index, exclusive.
     */
    public record Range(int start, int end) {
    }

    /** Words that may precede the type word within the same declaration. */
    private static final Set<String> DECLARATION_PREFIXES = Set.of(
            "static", "extern", "auto", "register", "inline", "volatile", "restrict", "const", Keywords.MUT,
            "signed", "unsigned", "short", "long", "struct", "union", "enum");

    private SourceStructure() {
    }

    /**
     * Decides whether the word at {@code typeIndex} can begin a declaration, judged by the
     * token before it. Statement boundaries ({@code ;}, braces, a for-header parenthesis, a
     * preprocessor line) and declaration prefixes such as storage classes qualify; operators,
     * {@code return}, commas and argument parentheses do not, so {@code a * b} in an
     * expression is never read as a pointer declaration.
     * @param tokens    The token stream.
     * @param typeIndex Index of the candidate type word.
     * @return true if a declaration may start at {@code typeIndex}.
     */
    public static boolean atDeclarationStart(TokenStream tokens, int typeIndex) {
        int p = tokens.prevSignificant(typeIndex - 1);
        if (p < 0) {
            return true;
        }
        Token before = tokens.get(p);
        if (before.kind() == TokenKind.PREPROCESSOR) {
            return true;
        }
        if (before.kind() == TokenKind.PUNCTUATION) {
            if (before.is(";") || before.is("{") || before.is("}")) {
                return true;
            }
            if (before.is("(")) {
                int owner = tokens.prevSignificant(p - 1);
                return owner >= 0 && tokens.get(owner).is("for");
            }
            return false;
        }
        return before.kind() == TokenKind.KEYWORD && DECLARATION_PREFIXES.contains(before.text());
    }

    /**
     * Classifies the block opened by the brace at {@code braceIndex}.
     * @param tokens     The token stream.
     * @param braceIndex Index of an opening brace.
     * @return The block kind.
     */
    public static BlockKind blockKind(TokenStream tokens, int braceIndex) {
        int p = tokens.prevSignificant(braceIndex - 1);
        if (p < 0) {
            return BlockKind.OTHER;
        }
        Token before = tokens.get(p);
        if (Keywords.AGGREGATES.contains(before.text())) {
            return BlockKind.AGGREGATE;
        }
        if (before.kind() == TokenKind.IDENTIFIER) {
            int q = tokens.prevSignificant(p - 1);
            if (q >= 0 && Keywords.AGGREGATES.contains(tokens.get(q).text())) {
                return BlockKind.AGGREGATE;
            }
            return BlockKind.OTHER;
        }
        if (before.is("do")) {
            return BlockKind.LOOP;
        }
        if (before.is(")")) {
            int open = tokens.findEnclosingOpen(p, "(");
            if (open < 0) {
                return BlockKind.OTHER;
            }
            int q = tokens.prevSignificant(open - 1);
            if (q < 0) {
                return BlockKind.OTHER;
            }
            Token owner = tokens.get(q);
            if (owner.is("for") || owner.is("while")) {
                return BlockKind.LOOP;
            }
            if (owner.is("switch")) {
                return BlockKind.SWITCH;
            }
            if (owner.kind() == TokenKind.IDENTIFIER && braceDepth(tokens, open) == 0) {
                return BlockKind.FUNCTION;
            }
        }
        return BlockKind.OTHER;
    }

    /**
     * @param tokens The token stream.
     * @param index  A token index.
     * @return Indices of the opening braces enclosing {@code index}, innermost first.
     */
    public static List<Integer> enclosingBraces(TokenStream tokens, int index) {
        List<Integer> result = new ArrayList<>();
        int open = tokens.findEnclosingOpen(index, "{");
        while (open >= 0) {
            result.add(open);
            open = tokens.findEnclosingOpen(open, "{");
        }
        return result;
    }

    /**
     * @param tokens The token stream.
     * @param index  A token index.
     * @return The number of braces open at {@code index}.
     */
    public static int braceDepth(TokenStream tokens, int index) {
        int depth = 0;
        for (int i = 0; i < index && i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.kind() != TokenKind.PUNCTUATION) {
                continue;
            }
            if (t.is("{")) {
                depth++;
            } else if (t.is("}") && depth > 0) {
                depth--;
            }
        }
        return depth;
    }

    /**
     * A position is in a function body when some enclosing block is a function body and
     * the innermost enclosing block is not an aggregate body.
     * @param tokens The token stream.
     * @param index  A token index.
     * @return true for statement positions inside functions.
     */
    public static boolean inFunctionBody(TokenStream tokens, int index) {
        List<Integer> braces = enclosingBraces(tokens, index);
        if (braces.isEmpty() || blockKind(tokens, braces.get(0)) == BlockKind.AGGREGATE) {
            return false;
        }
        for (int brace : braces) {
            if (blockKind(tokens, brace) == BlockKind.FUNCTION) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param tokens The token stream.
     * @param index  A token index.
     * @return true if the innermost enclosing block is a struct, union or enum body.
     */
    public static boolean inAggregateBody(TokenStream tokens, int index) {
        int open = tokens.findEnclosingOpen(index, "{");
        return open >= 0 && blockKind(tokens, open) == BlockKind.AGGREGATE;
    }

    /**
     * Recognizes the parameter list of a top-level function declaration or definition,
     * i.e. {@code Type name (} outside of any brace or parenthesis.
     * @param tokens    The token stream.
     * @param parenIndex Index of an opening parenthesis.
     * @return true if the parenthesis opens a function parameter list.
     */
    public static boolean isParameterListOpen(TokenStream tokens, int parenIndex) {
        if (!tokens.get(parenIndex).is("(")
                || tokens.findEnclosingOpen(parenIndex, "(") >= 0
                || braceDepth(tokens, parenIndex) > 0) {
            return false;
        }
        int nameIndex = tokens.prevSignificant(parenIndex - 1);
        if (nameIndex < 0 || tokens.get(nameIndex).kind() != TokenKind.IDENTIFIER) {
            return false;
        }
        int typeIndex = tokens.prevSignificant(nameIndex - 1);
        if (typeIndex < 0) {
            return false;
        }
        Token type = tokens.get(typeIndex);
        return type.is("*") || (type.isWord() && !Keywords.NON_TYPE_KEYWORDS.contains(type.text()));
    }

    /**
     * Splits the contents of a bracketed group at top-level commas.
     * @param tokens     The token stream.
     * @param openIndex  Index of the opening bracket.
     * @param closeIndex Index of the matching closing bracket.
     * @return One range per element; a group with no significant tokens yields no range.
     */
    public static List<Range> splitTopLevel(TokenStream tokens, int openIndex, int closeIndex) {
        List<Range> ranges = new ArrayList<>();
        if (!hasSignificant(tokens, openIndex + 1, closeIndex)) {
            return ranges;
        }
        int depth = 0;
        int start = openIndex + 1;
        for (int i = openIndex + 1; i < closeIndex; i++) {
            Token t = tokens.get(i);
            if (t.kind() != TokenKind.PUNCTUATION) {
                continue;
            }
            switch (t.text()) {
                case "(", "[", "{" -> depth++;
                case ")", "]", "}" -> depth--;
                case "," -> {
                    if (depth == 0) {
                        ranges.add(new Range(start, i));
                        start = i + 1;
                    }
                }
                default -> {
                }
            }
        }
        ranges.add(new Range(start, closeIndex));
        return ranges;
    }

    /**
     * @param tokens The token stream.
     * @param from   First index, inclusive.
     * @param to     Last index, exclusive.
     * @return true if any token in the range is significant.
     */
    public static boolean hasSignificant(TokenStream tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).isSignificant()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param tokens The token stream.
     * @param from   First index, inclusive.
     * @param to     Last index, exclusive.
     * @return The indices of significant tokens in the range.
     */
    public static List<Integer> significantIndices(TokenStream tokens, int from, int to) {
        List<Integer> result = new ArrayList<>();
        for (int i = from; i < to; i++) {
            if (tokens.get(i).isSignificant()) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Joins the text of the significant tokens in a range with single spaces removed,
     * e.g. for echoing a type or expression in a message.
     * @param tokens The token stream.
     * @param from   First index, inclusive.
     * @param to     Last index, exclusive.
     * @return The compact source text.
     */
    public static String compactText(TokenStream tokens, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.isSignificant()) {
                if (!sb.isEmpty() && t.isWord() && Character.isLetterOrDigit(sb.charAt(sb.length() - 1))) {
                    sb.append(' ');
                }
                sb.append(t.text());
            }
        }
        return sb.toString();
    }
}
