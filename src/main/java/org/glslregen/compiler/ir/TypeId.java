package org.glslregen.compiler.ir;

/**
 * Handle into the type table of a {@link Pack}.
 * The value {@code 0} is the reserved "unset" sentinel and never names a table entry.
 *
 * @param id The raw handle value.
 */
public record TypeId(int id) implements Comparable<TypeId> {

    /** The sentinel handle. */
    public static final TypeId INVALID = new TypeId(0);

    public TypeId {
        if (id < 0) {
            throw new IllegalArgumentException("TypeId must not be negative: " + id);
        }
    }

    /**
     * @return {@code true} unless this is the sentinel handle.
     */
    public boolean isValid() {
        return id != 0;
    }

    @Override
    public int compareTo(TypeId other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "type#" + id;
    }
}
