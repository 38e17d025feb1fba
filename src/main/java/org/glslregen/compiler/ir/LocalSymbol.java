package org.glslregen.compiler.ir;

import java.util.Objects;

/**
 * A function parameter or local variable.
 *
 * @param type The declared type.
 * @param name The source name.
 */
public record LocalSymbol(TypeId type, String name) {

    public LocalSymbol {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
    }
}
