package org.glslregen.compiler.ir;

import java.util.List;
import java.util.Objects;

/**
 * A type reference as written in source.
 *
 * @param precision   Precision qualifier such as {@code highp}; empty when absent.
 * @param name        The base type name, e.g. {@code vec4} or a struct name.
 * @param arraySizes  Array dimensions in declaration order; empty for non-array types.
 * @param memberNames Struct member names in declaration order; empty for non-struct types.
 * @param memberTypes Types of the struct members, parallel to {@code memberNames}; may be empty
 *                    when member types are unknown.
 */
public record Type(String precision, String name, List<Integer> arraySizes, List<String> memberNames,
                   List<TypeId> memberTypes) {

    public Type {
        precision = precision == null ? "" : precision;
        Objects.requireNonNull(name, "name");
        arraySizes = List.copyOf(arraySizes);
        memberNames = List.copyOf(memberNames);
        memberTypes = List.copyOf(memberTypes);
        if (!memberTypes.isEmpty() && memberTypes.size() != memberNames.size()) {
            throw new IllegalArgumentException("Type " + name + " has " + memberNames.size()
                    + " member names but " + memberTypes.size() + " member types");
        }
    }

    public Type(String precision, String name, List<Integer> arraySizes, List<String> memberNames) {
        this(precision, name, arraySizes, memberNames, List.of());
    }

    public Type(String precision, String name, List<Integer> arraySizes) {
        this(precision, name, arraySizes, List.of(), List.of());
    }

    /**
     * A plain scalar/vector/struct type with no qualifier and no array dimensions.
     */
    public static Type of(String name) {
        return new Type("", name, List.of(), List.of(), List.of());
    }
}
