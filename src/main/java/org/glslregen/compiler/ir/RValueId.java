package org.glslregen.compiler.ir;

/**
 * Handle into the r-value table of a {@link Pack}.
 * The value {@code 0} is the reserved "unset" sentinel and never names a table entry.
 *
 * @param id The raw handle value.
 */
public record RValueId(int id) implements Comparable<RValueId>, ValueId {

    /** The sentinel handle. */
    public static final RValueId INVALID = new RValueId(0);

    public RValueId {
        if (id < 0) {
            throw new IllegalArgumentException("RValueId must not be negative: " + id);
        }
    }

    /**
     * @return {@code true} unless this is the sentinel handle.
     */
    public boolean isValid() {
        return id != 0;
    }

    @Override
    public int compareTo(RValueId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "rvalue#" + id;
    }
}
