package org.glslregen.compiler.ir;

/**
 * Handle into the function-name table of a {@link Pack}. Prototypes and definitions are both keyed by it.
 * The value {@code 0} is the reserved "unset" sentinel and never names a table entry.
 *
 * @param id The raw handle value.
 */
public record FunctionId(int id) implements Comparable<FunctionId>, RValueTarget {

    /** The sentinel handle. */
    public static final FunctionId INVALID = new FunctionId(0);

    public FunctionId {
        if (id < 0) {
            throw new IllegalArgumentException("FunctionId must not be negative: " + id);
        }
    }

    /**
     * @return {@code true} unless this is the sentinel handle.
     */
    public boolean isValid() {
        return id != 0;
    }

    @Override
    public int compareTo(FunctionId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "function#" + id;
    }
}
