package org.glslregen.compiler.ir;

/**
 * Any operand usable inside an expression: a computed r-value, a global symbol or a
 * function-local symbol.
 */
public sealed interface ValueId permits RValueId, GlobalSymbolId, LocalSymbolId {

    /**
     * @return The raw handle value of the referenced entity.
     */
    int id();
}
