package org.glslregen.compiler.ir;

/**
 * Constant payload of a {@link LiteralRValue}. One variant per scalar kind the shading language
 * can spell as a literal.
 */
public sealed interface Literal {

    record BoolLiteral(boolean value) implements Literal {
    }

    record IntLiteral(int value) implements Literal {
    }

    /**
     * An unsigned 32-bit constant, held widened so the full range stays non-negative.
     */
    record UintLiteral(long value) implements Literal {
        public UintLiteral {
            if (value < 0 || value > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("uint literal out of range: " + value);
            }
        }
    }

    record FloatLiteral(float value) implements Literal {
    }

    record DoubleLiteral(double value) implements Literal {
    }
}
