package org.glslregen.compiler.ir;

import java.util.Objects;

/**
 * A constant.
 *
 * @param literal The constant payload.
 */
public record LiteralRValue(Literal literal) implements RValue {

    public LiteralRValue {
        Objects.requireNonNull(literal, "literal");
    }
}
