package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.api.MalformedIrException;
import org.glslregen.compiler.ir.EvaluableRValue;
import org.glslregen.compiler.ir.FunctionDefinition;
import org.glslregen.compiler.ir.Literal;
import org.glslregen.compiler.ir.LiteralRValue;
import org.glslregen.compiler.ir.LocalSymbolId;
import org.glslregen.compiler.ir.Pack;
import org.glslregen.compiler.ir.RValueId;
import org.glslregen.compiler.ir.RValueOperator;
import org.glslregen.compiler.ir.Type;
import org.glslregen.compiler.ir.ValueId;

import java.util.List;
import java.util.Optional;

/**
 * Emits built-in operator applications according to their {@link RValueOperator.Shape}.
 * <p>
 * Binary operators are always fully parenthesized. The IR carries no precedence information, so
 * this is the only layout that re-parses to the same grouping under any precedence table.
 */
class OperatorEmitter {

    private static final String SWIZZLE_COMPONENTS = "xyzw";

    private final Pack pack;
    private final ExpressionEmitter expressions;

    OperatorEmitter(Pack pack, ExpressionEmitter expressions) {
        this.pack = pack;
        this.expressions = expressions;
    }

    void emit(FunctionDefinition function, RValueOperator op, List<ValueId> args, StringBuilder out) {
        checkArity(op, args);
        switch (op.shape()) {
            case PREFIX_GROUPED -> {
                out.append(op.token()).append('(');
                value(function, args.get(0), out);
                out.append(')');
            }
            case PREFIX -> {
                out.append(op.token());
                value(function, args.get(0), out);
            }
            case POSTFIX -> {
                value(function, args.get(0), out);
                out.append(op.token());
            }
            case INFIX -> {
                out.append('(');
                value(function, args.get(0), out);
                out.append(' ').append(op.token()).append(' ');
                value(function, args.get(1), out);
                out.append(')');
            }
            case INDEX -> {
                value(function, args.get(0), out);
                out.append('[');
                value(function, args.get(1), out);
                out.append(']');
            }
            case STRUCT_FIELD -> emitStructField(function, op, args, out);
            case SWIZZLE -> emitSwizzle(function, op, args, out);
            case CONDITIONAL -> {
                out.append("((");
                value(function, args.get(0), out);
                out.append(") ? (");
                value(function, args.get(1), out);
                out.append(") : (");
                value(function, args.get(2), out);
                out.append("))");
            }
            case GENERIC -> {
                out.append('(').append(op.displayName());
                for (ValueId arg : args) {
                    out.append(' ');
                    value(function, arg, out);
                }
                out.append(')');
            }
            default -> throw new MalformedIrException("Unreachable operator shape: " + op.shape());
        }
    }

    private void emitStructField(FunctionDefinition function, RValueOperator op, List<ValueId> args,
                                 StringBuilder out) {
        int member = selector(op, args.get(1));
        value(function, args.get(0), out);
        out.append('.');
        List<String> memberNames = structType(function, args.get(0)).map(Type::memberNames).orElse(List.of());
        if (member >= 0 && member < memberNames.size()) {
            out.append(memberNames.get(member));
        } else {
            out.append("field").append(member);
        }
    }

    private void emitSwizzle(FunctionDefinition function, RValueOperator op, List<ValueId> args,
                             StringBuilder out) {
        if (args.size() < 2 || args.size() > 5) {
            throw new MalformedIrException(
                    op.displayName() + " takes a base and one to four components, got " + args.size() + " arguments");
        }
        StringBuilder components = new StringBuilder(4);
        for (ValueId arg : args.subList(1, args.size())) {
            int component = selector(op, arg);
            if (component < 0 || component >= SWIZZLE_COMPONENTS.length()) {
                throw new MalformedIrException(op.displayName() + " component out of range: " + component);
            }
            components.append(SWIZZLE_COMPONENTS.charAt(component));
        }
        value(function, args.get(0), out);
        out.append('.').append(components);
    }

    /**
     * Member and component selectors are int literals naming a position.
     */
    private int selector(RValueOperator op, ValueId arg) {
        if (arg instanceof RValueId rValueId && rValueId.isValid()
                && pack.rValue(rValueId) instanceof LiteralRValue literal
                && literal.literal() instanceof Literal.IntLiteral index) {
            return index.value();
        }
        throw new MalformedIrException(op.displayName() + " selector must be an int literal, got " + arg);
    }

    /**
     * Best-effort lookup of the type a member is selected from. Local symbols carry a type, array
     * elements share their array's type and a struct field has the member type recorded in its
     * parent struct, when the pack provides one.
     */
    private Optional<Type> structType(FunctionDefinition function, ValueId base) {
        if (base instanceof LocalSymbolId local && local.isValid()) {
            return Optional.of(pack.type(function.localSymbol(local).type()));
        }
        if (base instanceof RValueId rValueId && rValueId.isValid()
                && pack.rValue(rValueId) instanceof EvaluableRValue evaluable
                && !evaluable.args().isEmpty()) {
            if (evaluable.target() == RValueOperator.INDEX) {
                return structType(function, evaluable.args().get(0));
            }
            if (evaluable.target() == RValueOperator.INDEX_STRUCT && evaluable.args().size() == 2) {
                int member = selector(RValueOperator.INDEX_STRUCT, evaluable.args().get(1));
                return structType(function, evaluable.args().get(0))
                        .map(Type::memberTypes)
                        .filter(types -> member >= 0 && member < types.size())
                        .map(types -> pack.type(types.get(member)));
            }
        }
        return Optional.empty();
    }

    private static void checkArity(RValueOperator op, List<ValueId> args) {
        int arity = op.shape().arity();
        if (arity >= 0 && args.size() != arity) {
            throw new MalformedIrException(
                    op.displayName() + " must be " + arityName(arity) + " operator, got " + args.size() + " arguments");
        }
    }

    private static String arityName(int arity) {
        return switch (arity) {
            case 1 -> "a unary";
            case 2 -> "a binary";
            case 3 -> "a ternary";
            default -> "an " + arity + "-ary";
        };
    }

    private void value(FunctionDefinition function, ValueId valueId, StringBuilder out) {
        expressions.emitValue(function, valueId, out);
    }
}
