package org.glslregen.compiler.ir;

import java.util.Objects;

/**
 * A global variable, uniform or block member visible from every function.
 *
 * @param name The source name.
 */
public record GlobalSymbol(String name) {

    public GlobalSymbol {
        Objects.requireNonNull(name, "name");
    }
}
