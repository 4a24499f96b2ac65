package org.czar.compiler.frontend.semantics;

import java.util.HashMap;
import java.util.Map;

/**
 * Identifier name to pointer-ness, keyed by the position of the declaration.
 * <p>
 * The earliest declaration of a name wins. A usage only resolves against a declaration
 * that precedes it in the token stream.
 */
public class PointerTrackingTable {

    private record Entry(boolean pointer, int position) {
    }

    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * Records a declaration. A later declaration of an already tracked name is ignored
     * unless it occurs earlier in the stream.
     * @param name     The declared identifier.
     * @param pointer  Whether it is declared with pointer type.
     * @param position The token index of the declared name.
     */
    public void track(String name, boolean pointer, int position) {
        Entry existing = entries.get(name);
        if (existing == null || position < existing.position()) {
            entries.put(name, new Entry(pointer, position));
        }
    }

    /**
     * @param name     The identifier used.
     * @param position The token index of the usage.
     * @return true if {@code name} is declared as a pointer before {@code position}.
     */
    public boolean isPointerAt(String name, int position) {
        Entry entry = entries.get(name);
        return entry != null && position > entry.position() && entry.pointer();
    }

    public boolean isTracked(String name) {
        return entries.containsKey(name);
    }

    public void clear() {
        entries.clear();
    }
}
