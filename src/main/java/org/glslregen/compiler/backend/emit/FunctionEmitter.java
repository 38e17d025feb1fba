package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.ir.FunctionDefinition;
import org.glslregen.compiler.ir.FunctionId;
import org.glslregen.compiler.ir.LocalSymbolId;
import org.glslregen.compiler.ir.Pack;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Emits a function as a prototype ({@code vec4 shade(vec3 n);}) or as a full definition with its
 * local declarations and body.
 */
public class FunctionEmitter {

    private final Pack pack;
    private final TypePrinter typePrinter;
    private final SymbolPrinter symbolPrinter;
    private final BlockEmitter blockEmitter;
    private final RegeneratorOptions options;

    public FunctionEmitter(Pack pack, TypePrinter typePrinter, SymbolPrinter symbolPrinter,
                           BlockEmitter blockEmitter, RegeneratorOptions options) {
        this.pack = pack;
        this.typePrinter = typePrinter;
        this.symbolPrinter = symbolPrinter;
        this.blockEmitter = blockEmitter;
        this.options = options;
    }

    /**
     * Emits one function.
     * <p>
     * A prototype request for a function that has no definition anywhere in the pack emits
     * nothing: such declarations are dead and are pruned from the output.
     *
     * @param functionId The function.
     * @param withBody   {@code true} for a definition, {@code false} for a prototype.
     * @param out        The output buffer.
     * @return {@code true} if anything was emitted.
     * @throws org.glslregen.compiler.api.MissingEntityException if a body is requested for a
     *         function without a definition.
     */
    public boolean emitFunction(FunctionId functionId, boolean withBody, StringBuilder out) {
        Optional<FunctionDefinition> found = pack.findFunctionDefinition(functionId);
        if (!withBody && found.isEmpty()) {
            return false;
        }
        FunctionDefinition function = found.orElseGet(() -> pack.functionDefinition(functionId));

        typePrinter.print(function.returnType(), out);
        out.append(' ').append(ExpressionEmitter.displayName(pack, function.name())).append('(');
        List<LocalSymbolId> parameters = function.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            symbolPrinter.printLocal(function, parameters.get(i), true, out);
        }
        out.append(')');

        if (!withBody) {
            out.append(";\n");
            return true;
        }

        out.append(" {\n");
        Set<LocalSymbolId> parameterIds = new HashSet<>(parameters);
        String indent = options.indent(1);
        for (LocalSymbolId local : function.localSymbols().keySet()) {
            if (!parameterIds.contains(local)) {
                out.append(indent);
                symbolPrinter.printLocal(function, local, true, out);
                out.append(";\n");
            }
        }
        blockEmitter.emitBlock(function, function.body(), 1, out);
        out.append("}\n");
        return true;
    }
}
