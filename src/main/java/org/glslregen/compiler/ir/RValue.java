package org.glslregen.compiler.ir;

/**
 * An expression node stored in the r-value table of a {@link Pack}.
 */
public sealed interface RValue permits EvaluableRValue, LiteralRValue {
}
