package org.czar.compiler.backend;

import org.czar.compiler.model.Token;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes lowered tokens back out as C source. Tokens carry their own whitespace and
 * comments, so emitting is plain concatenation of token text.
 */
public final class SourceEmitter {

    private SourceEmitter() {
    }

    /**
     * @param tokens The lowered tokens.
     * @return The C source text.
     */
    public static String emit(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.text());
        }
        return sb.toString();
    }

    /**
     * Streams the lowered tokens to a writer.
     * @param tokens The lowered tokens.
     * @param out    The destination; it is not closed.
     * @throws IOException if writing fails.
     */
    public static void emit(List<Token> tokens, Writer out) throws IOException {
        for (Token t : tokens) {
            if (!t.isBlank()) {
                out.write(t.text());
            }
        }
        out.flush();
    }
}
