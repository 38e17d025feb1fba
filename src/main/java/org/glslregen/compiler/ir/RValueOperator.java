package org.glslregen.compiler.ir;

/**
 * Built-in operators an {@link EvaluableRValue} can apply. Each operator knows the textual shape it
 * is emitted in and, where it has one, its source token.
 */
public enum RValueOperator implements RValueTarget {

    // Unary
    NEGATIVE(Shape.PREFIX_GROUPED, "-"),
    LOGICAL_NOT(Shape.PREFIX_GROUPED, "!"),
    BITWISE_NOT(Shape.PREFIX_GROUPED, "~"),
    PRE_INCREMENT(Shape.PREFIX, "++"),
    PRE_DECREMENT(Shape.PREFIX, "--"),
    POST_INCREMENT(Shape.POSTFIX, "++"),
    POST_DECREMENT(Shape.POSTFIX, "--"),
    ARRAY_LENGTH(Shape.POSTFIX, ".length"),

    // Binary
    ADD(Shape.INFIX, "+"),
    SUB(Shape.INFIX, "-"),
    MUL(Shape.INFIX, "*"),
    DIV(Shape.INFIX, "/"),
    MOD(Shape.INFIX, "%"),
    RIGHT_SHIFT(Shape.INFIX, ">>"),
    LEFT_SHIFT(Shape.INFIX, "<<"),
    AND(Shape.INFIX, "&"),
    INCLUSIVE_OR(Shape.INFIX, "|"),
    EXCLUSIVE_OR(Shape.INFIX, "^"),
    EQUAL(Shape.INFIX, "=="),
    NOT_EQUAL(Shape.INFIX, "!="),
    LESS_THAN(Shape.INFIX, "<"),
    GREATER_THAN(Shape.INFIX, ">"),
    LESS_THAN_EQUAL(Shape.INFIX, "<="),
    GREATER_THAN_EQUAL(Shape.INFIX, ">="),
    COMMA(Shape.INFIX, ","),
    LOGICAL_OR(Shape.INFIX, "||"),
    LOGICAL_XOR(Shape.INFIX, "^^"),
    LOGICAL_AND(Shape.INFIX, "&&"),
    INDEX(Shape.INDEX, null),
    INDEX_STRUCT(Shape.STRUCT_FIELD, null),
    VECTOR_SWIZZLE(Shape.SWIZZLE, null),
    ASSIGN(Shape.INFIX, "="),
    ADD_ASSIGN(Shape.INFIX, "+="),
    SUB_ASSIGN(Shape.INFIX, "-="),
    MUL_ASSIGN(Shape.INFIX, "*="),
    DIV_ASSIGN(Shape.INFIX, "/="),
    MOD_ASSIGN(Shape.INFIX, "%="),
    AND_ASSIGN(Shape.INFIX, "&="),
    INCLUSIVE_OR_ASSIGN(Shape.INFIX, "|="),
    EXCLUSIVE_OR_ASSIGN(Shape.INFIX, "^="),
    LEFT_SHIFT_ASSIGN(Shape.INFIX, "<<="),
    RIGHT_SHIFT_ASSIGN(Shape.INFIX, ">>="),

    // Ternary
    TERNARY(Shape.CONDITIONAL, null),

    // Misc
    CONSTRUCT_STRUCT(Shape.GENERIC, null);

    /**
     * How an operator is laid out around its operands.
     */
    public enum Shape {
        /** {@code OP(arg)} */
        PREFIX_GROUPED(1),
        /** {@code OParg} */
        PREFIX(1),
        /** {@code argOP} */
        POSTFIX(1),
        /** {@code (lhs OP rhs)} */
        INFIX(2),
        /** {@code base[index]} */
        INDEX(2),
        /** {@code base.member} */
        STRUCT_FIELD(2),
        /** {@code base.xyzw}; one to four component selectors after the base. */
        SWIZZLE(-1),
        /** {@code ((cond) ? (then) : (else))} */
        CONDITIONAL(3),
        /** {@code (Name arg arg ...)} with any number of arguments. */
        GENERIC(-1);

        private final int arity;

        Shape(int arity) {
            this.arity = arity;
        }

        /**
         * @return The fixed operand count, or {@code -1} if the shape takes a variable number.
         */
        public int arity() {
            return arity;
        }
    }

    private final Shape shape;
    private final String token;
    private final String displayName;

    RValueOperator(Shape shape, String token) {
        this.shape = shape;
        this.token = token;
        this.displayName = toDisplayName(name());
    }

    public Shape shape() {
        return shape;
    }

    /**
     * @return The source token, or {@code null} for shapes that are not spelled with one.
     */
    public String token() {
        return token;
    }

    /**
     * @return The PascalCase operator name, e.g. {@code ConstructStruct}. Used by the generic
     *         shape and in diagnostics.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Looks an operator up by its display name or enum constant name.
     *
     * @param name e.g. {@code "AddAssign"} or {@code "ADD_ASSIGN"}.
     * @return The operator.
     * @throws IllegalArgumentException if no operator has that name.
     */
    public static RValueOperator fromName(String name) {
        for (RValueOperator op : values()) {
            if (op.displayName.equals(name) || op.name().equals(name)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown r-value operator: " + name);
    }

    private static String toDisplayName(String constantName) {
        StringBuilder sb = new StringBuilder(constantName.length());
        for (String part : constantName.split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
