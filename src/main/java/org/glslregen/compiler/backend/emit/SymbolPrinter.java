package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.ir.FunctionDefinition;
import org.glslregen.compiler.ir.GlobalSymbolId;
import org.glslregen.compiler.ir.LocalSymbol;
import org.glslregen.compiler.ir.LocalSymbolId;
import org.glslregen.compiler.ir.Pack;

/**
 * Renders references to global and function-local symbols. Sentinel ids are printed as a marker
 * token without touching any table.
 */
public class SymbolPrinter {

    static final String INVALID_GLOBAL_SYMBOL = "INVALID_GLOBAL_SYMBOL";
    static final String INVALID_LOCAL_SYMBOL = "INVALID_LOCAL_SYMBOL";

    private final Pack pack;
    private final TypePrinter typePrinter;

    public SymbolPrinter(Pack pack, TypePrinter typePrinter) {
        this.pack = pack;
        this.typePrinter = typePrinter;
    }

    public void printGlobal(GlobalSymbolId id, StringBuilder out) {
        if (!id.isValid()) {
            out.append(INVALID_GLOBAL_SYMBOL);
            return;
        }
        out.append(pack.globalSymbol(id).name());
    }

    /**
     * Appends a local symbol reference.
     *
     * @param function    The function owning the symbol table to resolve against.
     * @param id          The symbol.
     * @param declaration If set, prefix the name with its type ({@code vec3 normal}) as used in
     *                    parameter lists and variable declarations.
     * @param out         The output buffer.
     */
    public void printLocal(FunctionDefinition function, LocalSymbolId id, boolean declaration, StringBuilder out) {
        if (!id.isValid()) {
            out.append(INVALID_LOCAL_SYMBOL);
            return;
        }
        LocalSymbol symbol = function.localSymbol(id);
        if (declaration) {
            typePrinter.print(symbol.type(), out);
            out.append(' ');
        }
        out.append(symbol.name());
    }
}
