package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.api.MalformedIrException;
import org.glslregen.compiler.ir.Literal;
import org.glslregen.compiler.ir.Literal.BoolLiteral;
import org.glslregen.compiler.ir.Literal.DoubleLiteral;
import org.glslregen.compiler.ir.Literal.FloatLiteral;
import org.glslregen.compiler.ir.Literal.IntLiteral;
import org.glslregen.compiler.ir.Literal.UintLiteral;

/**
 * Spells constants in shading-language lexical form.
 * <p>
 * Negative values are parenthesized so that a literal can be dropped into any operand position.
 * Floating-point values always carry a decimal point or an exponent so they never re-parse as
 * integers; non-finite values, which have no literal spelling, are written as constant divisions.
 */
public final class LiteralFormatter {

    private LiteralFormatter() {
    }

    public static String format(Literal literal) {
        if (literal instanceof BoolLiteral b) {
            return Boolean.toString(b.value());
        } else if (literal instanceof IntLiteral i) {
            return i.value() < 0 ? "(" + i.value() + ")" : Integer.toString(i.value());
        } else if (literal instanceof UintLiteral u) {
            return u.value() + "u";
        } else if (literal instanceof FloatLiteral f) {
            return formatFloating(Float.toString(f.value()), f.value(), "");
        } else if (literal instanceof DoubleLiteral d) {
            return formatFloating(Double.toString(d.value()), d.value(), "lf");
        }
        throw new MalformedIrException("Unreachable literal kind: " + literal);
    }

    private static String formatFloating(String javaText, double value, String suffix) {
        if (Double.isNaN(value)) {
            return "(0.0" + suffix + " / 0.0" + suffix + ")";
        }
        if (Double.isInfinite(value)) {
            return (value > 0 ? "(1.0" : "(-1.0") + suffix + " / 0.0" + suffix + ")";
        }
        // Java's shortest round-trip form is already "1.0" or "1.0E-5", both valid here.
        String text = javaText + suffix;
        return value < 0 || (value == 0 && 1 / value < 0) ? "(" + text + ")" : text;
    }
}
