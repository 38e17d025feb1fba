package org.glslregen.compiler.ir;

import java.util.List;
import java.util.Objects;

/**
 * An operator application or function call over an ordered list of operands.
 *
 * @param target The operator or callee.
 * @param args   The operands in source order.
 */
public record EvaluableRValue(RValueTarget target, List<ValueId> args) implements RValue {

    public EvaluableRValue {
        Objects.requireNonNull(target, "target");
        args = List.copyOf(args);
    }

    /**
     * Convenience factory for operator applications.
     */
    public static EvaluableRValue of(RValueOperator operator, ValueId... args) {
        return new EvaluableRValue(operator, List.of(args));
    }

    /**
     * Convenience factory for function calls.
     */
    public static EvaluableRValue call(FunctionId function, ValueId... args) {
        return new EvaluableRValue(function, List.of(args));
    }
}
