package org.glslregen.compiler.ir;

/**
 * What an {@link EvaluableRValue} applies to its arguments: either a built-in operator or a
 * user function.
 */
public sealed interface RValueTarget permits RValueOperator, FunctionId {
}
