package org.glslregen.compiler.ir;

/**
 * Handle into the local-symbol table of one {@link FunctionDefinition}.
 * The value {@code 0} is the reserved "unset" sentinel and never names a table entry.
 *
 * @param id The raw handle value.
 */
public record LocalSymbolId(int id) implements Comparable<LocalSymbolId>, ValueId {

    /** The sentinel handle. */
    public static final LocalSymbolId INVALID = new LocalSymbolId(0);

    public LocalSymbolId {
        if (id < 0) {
            throw new IllegalArgumentException("LocalSymbolId must not be negative: " + id);
        }
    }

    /**
     * @return {@code true} unless this is the sentinel handle.
     */
    public boolean isValid() {
        return id != 0;
    }

    @Override
    public int compareTo(LocalSymbolId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "local#" + id;
    }
}
