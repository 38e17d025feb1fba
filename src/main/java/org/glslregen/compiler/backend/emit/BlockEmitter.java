package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.api.MalformedIrException;
import org.glslregen.compiler.ir.FunctionDefinition;
import org.glslregen.compiler.ir.Pack;
import org.glslregen.compiler.ir.Statement;
import org.glslregen.compiler.ir.Statement.BranchStatement;
import org.glslregen.compiler.ir.Statement.ExpressionStatement;
import org.glslregen.compiler.ir.Statement.IfStatement;
import org.glslregen.compiler.ir.Statement.LoopStatement;
import org.glslregen.compiler.ir.Statement.SwitchStatement;
import org.glslregen.compiler.ir.StatementBlockId;

/**
 * Emits statement blocks with depth-tracked indentation, recursing into nested blocks.
 * <p>
 * Statements of a block at depth {@code d} are indented {@code d} units; the braces that close a
 * nested block are written at the indent of the statement that opened it. {@code case} and
 * {@code default} labels sit one unit left of the statements they guard.
 */
public class BlockEmitter {

    private final Pack pack;
    private final ExpressionEmitter expressions;
    private final RegeneratorOptions options;

    public BlockEmitter(Pack pack, ExpressionEmitter expressions, RegeneratorOptions options) {
        this.pack = pack;
        this.expressions = expressions;
        this.options = options;
    }

    /**
     * @param function The function the block belongs to.
     * @param blockId  The block to emit.
     * @param depth    Nesting depth of the block's statements; a function body is depth 1.
     * @param out      The output buffer.
     * @throws org.glslregen.compiler.api.MissingEntityException if the block or anything it
     *         references is not in the pack.
     */
    public void emitBlock(FunctionDefinition function, StatementBlockId blockId, int depth, StringBuilder out) {
        String parentIndent = options.indent(depth - 1);
        String indent = options.indent(depth);
        for (Statement statement : pack.statementBlock(blockId)) {
            if (statement instanceof ExpressionStatement expression) {
                out.append(indent);
                expressions.emitRValue(function, expression.expression(), out);
                out.append(";\n");
            } else if (statement instanceof IfStatement ifStatement) {
                emitIf(function, ifStatement, depth, indent, out);
            } else if (statement instanceof SwitchStatement switchStatement) {
                out.append(indent).append("switch (");
                expressions.emitValue(function, switchStatement.condition(), out);
                out.append(") {\n");
                emitBlock(function, switchStatement.body(), depth + 1, out);
                out.append(indent).append("}\n");
            } else if (statement instanceof BranchStatement branch) {
                emitBranch(function, branch, branch.operator().isLabel() ? parentIndent : indent, out);
            } else if (statement instanceof LoopStatement loop) {
                emitLoop(function, loop, depth, indent, out);
            } else {
                throw new MalformedIrException("Unreachable statement kind: " + statement);
            }
        }
    }

    private void emitIf(FunctionDefinition function, IfStatement ifStatement, int depth, String indent,
                        StringBuilder out) {
        out.append(indent).append("if (");
        expressions.emitValue(function, ifStatement.condition(), out);
        out.append(") {\n");
        emitBlock(function, ifStatement.thenBlock(), depth + 1, out);
        if (ifStatement.elseBlock().isPresent()) {
            out.append(indent).append("} else {\n");
            emitBlock(function, ifStatement.elseBlock().get(), depth + 1, out);
        }
        out.append(indent).append("}\n");
    }

    private void emitBranch(FunctionDefinition function, BranchStatement branch, String indent, StringBuilder out) {
        out.append(indent).append(branch.operator().keyword());
        if (branch.operand().isPresent()) {
            out.append(' ');
            expressions.emitValue(function, branch.operand().get(), out);
        }
        out.append(branch.operator().isLabel() ? ":\n" : ";\n");
    }

    private void emitLoop(FunctionDefinition function, LoopStatement loop, int depth, String indent,
                          StringBuilder out) {
        if (loop.testFirst()) {
            if (loop.terminal().isPresent()) {
                out.append(indent).append("for (; ");
                expressions.emitValue(function, loop.condition(), out);
                out.append("; ");
                expressions.emitRValue(function, loop.terminal().get(), out);
            } else {
                out.append(indent).append("while (");
                expressions.emitValue(function, loop.condition(), out);
            }
            out.append(") {\n");
            emitBlock(function, loop.body(), depth + 1, out);
            out.append(indent).append("}\n");
        } else {
            out.append(indent).append("do {\n");
            emitBlock(function, loop.body(), depth + 1, out);
            out.append(indent).append("} while (");
            expressions.emitValue(function, loop.condition(), out);
            out.append(");\n");
        }
    }
}
