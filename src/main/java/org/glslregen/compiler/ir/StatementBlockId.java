package org.glslregen.compiler.ir;

/**
 * Handle into the statement-block table of a {@link Pack}.
 * The value {@code 0} is the reserved "unset" sentinel and never names a table entry.
 *
 * @param id The raw handle value.
 */
public record StatementBlockId(int id) implements Comparable<StatementBlockId> {

    /** The sentinel handle. */
    public static final StatementBlockId INVALID = new StatementBlockId(0);

    public StatementBlockId {
        if (id < 0) {
            throw new IllegalArgumentException("StatementBlockId must not be negative: " + id);
        }
    }

    /**
     * @return {@code true} unless this is the sentinel handle.
     */
    public boolean isValid() {
        return id != 0;
    }

    @Override
    public int compareTo(StatementBlockId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "block#" + id;
    }
}
