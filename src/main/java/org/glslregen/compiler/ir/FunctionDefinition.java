package org.glslregen.compiler.ir;

import org.glslregen.compiler.api.MissingEntityException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A function with a body. Owns the table of its parameters and local variables; parameters are
 * listed separately in declaration order and must also appear in that table.
 *
 * @param returnType   The return type.
 * @param name         The function's identity in the function-name table.
 * @param parameters   Parameter symbols in declaration order.
 * @param localSymbols Every parameter and local variable of the function, iterated in id order.
 * @param body         The top-level statement block.
 */
public record FunctionDefinition(
        TypeId returnType,
        FunctionId name,
        List<LocalSymbolId> parameters,
        SortedMap<LocalSymbolId, LocalSymbol> localSymbols,
        StatementBlockId body) {

    public FunctionDefinition {
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        parameters = List.copyOf(parameters);
        localSymbols = Collections.unmodifiableSortedMap(new TreeMap<>(localSymbols));
        if (localSymbols.containsKey(LocalSymbolId.INVALID)) {
            throw new IllegalArgumentException("Local symbol table of " + name + " contains the sentinel id");
        }
        for (LocalSymbolId parameter : parameters) {
            if (!localSymbols.containsKey(parameter)) {
                throw new IllegalArgumentException(
                        "Parameter " + parameter + " of " + name + " is not in its local symbol table");
            }
        }
    }

    public FunctionDefinition(TypeId returnType, FunctionId name, List<LocalSymbolId> parameters,
                              Map<LocalSymbolId, LocalSymbol> localSymbols, StatementBlockId body) {
        this(returnType, name, parameters, new TreeMap<>(localSymbols), body);
    }

    /**
     * Resolves a local symbol of this function.
     *
     * @param id A non-sentinel local symbol id.
     * @return The symbol.
     * @throws MissingEntityException if the id is not in this function's table.
     */
    public LocalSymbol localSymbol(LocalSymbolId id) {
        LocalSymbol symbol = localSymbols.get(id);
        if (symbol == null) {
            throw new MissingEntityException("local symbol", id.id());
        }
        return symbol;
    }
}
