package org.glslregen.compiler.ir;

/**
 * Jump and label statements. Labels ({@code case}, {@code default}) are terminated with a colon and
 * outdented to the level of the enclosing {@code switch}; everything else is terminated with a
 * semicolon.
 */
public enum BranchOperator {
    DISCARD("discard"),
    TERMINATE_INVOCATION("terminateInvocation"),
    DEMOTE("demote"),
    TERMINATE_RAY_EXT("terminateRayEXT"),
    IGNORE_INTERSECTION_EXT("ignoreIntersectionEXT"),
    RETURN("return"),
    BREAK("break"),
    CONTINUE("continue"),
    CASE("case"),
    DEFAULT("default");

    private final String keyword;

    BranchOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isLabel() {
        return this == CASE || this == DEFAULT;
    }

    /**
     * @param name Either the enum constant name ({@code TERMINATE_RAY_EXT}) or the keyword
     *             ({@code terminateRayEXT}), matched case-insensitively.
     * @throws IllegalArgumentException if nothing matches.
     */
    public static BranchOperator fromName(String name) {
        for (BranchOperator op : values()) {
            if (op.name().equalsIgnoreCase(name) || op.keyword.equalsIgnoreCase(name)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown branch operator: " + name);
    }
}
