package org.glslregen.compiler.ir;

/**
 * Handle into the global-symbol table of a {@link Pack}.
 * The value {@code 0} is the reserved "unset" sentinel and never names a table entry.
 *
 * @param id The raw handle value.
 */
public record GlobalSymbolId(int id) implements Comparable<GlobalSymbolId>, ValueId {

    /** The sentinel handle. */
    public static final GlobalSymbolId INVALID = new GlobalSymbolId(0);

    public GlobalSymbolId {
        if (id < 0) {
            throw new IllegalArgumentException("GlobalSymbolId must not be negative: " + id);
        }
    }

    /**
     * @return {@code true} unless this is the sentinel handle.
     */
    public boolean isValid() {
        return id != 0;
    }

    @Override
    public int compareTo(GlobalSymbolId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "global#" + id;
    }
}
