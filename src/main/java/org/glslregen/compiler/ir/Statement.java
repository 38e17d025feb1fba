package org.glslregen.compiler.ir;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a statement block.
 */
public sealed interface Statement {

    /**
     * An expression evaluated for its side effects.
     */
    record ExpressionStatement(RValueId expression) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression");
        }
    }

    record IfStatement(ValueId condition, StatementBlockId thenBlock, Optional<StatementBlockId> elseBlock)
            implements Statement {
        public IfStatement {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(thenBlock, "thenBlock");
            Objects.requireNonNull(elseBlock, "elseBlock");
        }
    }

    /**
     * The body holds the {@code case}/{@code default} labels as {@link BranchStatement}s interleaved
     * with the statements they guard.
     */
    record SwitchStatement(ValueId condition, StatementBlockId body) implements Statement {
        public SwitchStatement {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }
    }

    /**
     * @param operator The jump or label kind.
     * @param operand  Return value or case label expression, if any.
     */
    record BranchStatement(BranchOperator operator, Optional<ValueId> operand) implements Statement {
        public BranchStatement {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }
    }

    /**
     * @param condition The loop condition.
     * @param body      The loop body.
     * @param testFirst {@code true} for pre-test loops ({@code while}/{@code for}), {@code false}
     *                  for {@code do ... while}.
     * @param terminal  The increment expression of a {@code for} loop.
     */
    record LoopStatement(ValueId condition, StatementBlockId body, boolean testFirst, Optional<RValueId> terminal)
            implements Statement {
        public LoopStatement {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(terminal, "terminal");
        }
    }
}
