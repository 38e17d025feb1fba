package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.api.MalformedIrException;
import org.glslregen.compiler.ir.EvaluableRValue;
import org.glslregen.compiler.ir.FunctionDefinition;
import org.glslregen.compiler.ir.FunctionId;
import org.glslregen.compiler.ir.GlobalSymbolId;
import org.glslregen.compiler.ir.LiteralRValue;
import org.glslregen.compiler.ir.LocalSymbolId;
import org.glslregen.compiler.ir.Pack;
import org.glslregen.compiler.ir.RValue;
import org.glslregen.compiler.ir.RValueId;
import org.glslregen.compiler.ir.RValueOperator;
import org.glslregen.compiler.ir.ValueId;

import java.util.List;

/**
 * Renders expression operands and r-values. Operator applications are handed to an
 * {@link OperatorEmitter}, which calls back into this class for every operand.
 */
public class ExpressionEmitter {

    static final String INVALID_RVALUE = "INVALID_RVALUE";

    private final Pack pack;
    private final SymbolPrinter symbolPrinter;
    private final OperatorEmitter operatorEmitter;

    public ExpressionEmitter(Pack pack, SymbolPrinter symbolPrinter) {
        this.pack = pack;
        this.symbolPrinter = symbolPrinter;
        this.operatorEmitter = new OperatorEmitter(pack, this);
    }

    /**
     * Appends any operand. Local symbols are always rendered in use-site form.
     *
     * @param function The function whose local symbols are in scope.
     * @param valueId  The operand.
     * @param out      The output buffer.
     */
    public void emitValue(FunctionDefinition function, ValueId valueId, StringBuilder out) {
        if (valueId instanceof RValueId rValueId) {
            emitRValue(function, rValueId, out);
        } else if (valueId instanceof GlobalSymbolId globalSymbolId) {
            symbolPrinter.printGlobal(globalSymbolId, out);
        } else if (valueId instanceof LocalSymbolId localSymbolId) {
            symbolPrinter.printLocal(function, localSymbolId, false, out);
        } else {
            throw new MalformedIrException("Unreachable value kind: " + valueId);
        }
    }

    public void emitRValue(FunctionDefinition function, RValueId rValueId, StringBuilder out) {
        if (!rValueId.isValid()) {
            out.append(INVALID_RVALUE);
            return;
        }
        RValue rValue = pack.rValue(rValueId);
        if (rValue instanceof EvaluableRValue evaluable) {
            if (evaluable.target() instanceof RValueOperator operator) {
                operatorEmitter.emit(function, operator, evaluable.args(), out);
            } else if (evaluable.target() instanceof FunctionId callee) {
                emitFunctionCall(function, callee, evaluable.args(), out);
            } else {
                throw new MalformedIrException("Unreachable r-value target: " + evaluable.target());
            }
        } else if (rValue instanceof LiteralRValue literal) {
            out.append(LiteralFormatter.format(literal.literal()));
        } else {
            throw new MalformedIrException("Unreachable r-value kind: " + rValue);
        }
    }

    private void emitFunctionCall(FunctionDefinition function, FunctionId callee, List<ValueId> args,
                                  StringBuilder out) {
        out.append(displayName(pack, callee)).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            emitValue(function, args.get(i), out);
        }
        out.append(')');
    }

    /**
     * Strips the parameter signature from a mangled function name: {@code "shade(vf3;"} becomes
     * {@code "shade"}.
     */
    static String displayName(Pack pack, FunctionId functionId) {
        String mangled = pack.functionName(functionId);
        int parenthesis = mangled.indexOf('(');
        return parenthesis < 0 ? mangled : mangled.substring(0, parenthesis);
    }
}
