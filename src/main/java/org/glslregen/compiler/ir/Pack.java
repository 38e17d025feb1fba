package org.glslregen.compiler.ir;

import org.glslregen.compiler.api.MissingEntityException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A whole translation unit in id-indexed form.
 * <p>
 * Every entity lives in a table owned by the pack (local symbols excepted, which live in their
 * {@link FunctionDefinition}) and refers to other entities only through ids. A pack is immutable
 * once built; use {@link #builder()} to assemble one.
 *
 * <p>Lookups with a non-sentinel id that does not resolve throw {@link MissingEntityException}.
 * Callers are expected to handle the sentinel themselves before looking anything up.</p>
 */
public final class Pack {

    private final Map<TypeId, Type> types;
    private final Map<FunctionId, String> functionNames;
    private final Map<RValueId, RValue> rValues;
    private final Map<GlobalSymbolId, GlobalSymbol> globalSymbols;
    private final Map<StatementBlockId, List<Statement>> statementBlocks;
    private final Map<FunctionId, FunctionDefinition> functionDefinitions;
    private final List<FunctionId> functionPrototypes;
    private final List<FunctionId> functionDefinitionOrder;

    private Pack(Builder builder) {
        this.types = Map.copyOf(builder.types);
        this.functionNames = Map.copyOf(builder.functionNames);
        this.rValues = Map.copyOf(builder.rValues);
        this.globalSymbols = Map.copyOf(builder.globalSymbols);
        Map<StatementBlockId, List<Statement>> blocks = new HashMap<>();
        builder.statementBlocks.forEach((id, statements) -> blocks.put(id, List.copyOf(statements)));
        this.statementBlocks = Map.copyOf(blocks);
        this.functionDefinitions = Map.copyOf(builder.functionDefinitions);
        this.functionPrototypes = List.copyOf(builder.functionPrototypes);
        this.functionDefinitionOrder = List.copyOf(builder.functionDefinitionOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Type type(TypeId id) {
        return require(types.get(id), "type", id.id());
    }

    public String functionName(FunctionId id) {
        return require(functionNames.get(id), "function name", id.id());
    }

    public RValue rValue(RValueId id) {
        return require(rValues.get(id), "r-value", id.id());
    }

    public GlobalSymbol globalSymbol(GlobalSymbolId id) {
        return require(globalSymbols.get(id), "global symbol", id.id());
    }

    public List<Statement> statementBlock(StatementBlockId id) {
        return require(statementBlocks.get(id), "statement block", id.id());
    }

    public FunctionDefinition functionDefinition(FunctionId id) {
        return require(functionDefinitions.get(id), "function", id.id());
    }

    /**
     * @return The definition for {@code id}, or empty if the function is only ever declared.
     */
    public Optional<FunctionDefinition> findFunctionDefinition(FunctionId id) {
        return Optional.ofNullable(functionDefinitions.get(id));
    }

    /**
     * @return Functions to forward-declare, in the order the producer chose.
     */
    public List<FunctionId> functionPrototypes() {
        return functionPrototypes;
    }

    /**
     * @return Functions to define, in the order the producer chose.
     */
    public List<FunctionId> functionDefinitionOrder() {
        return functionDefinitionOrder;
    }

    public int typeCount() {
        return types.size();
    }

    public int rValueCount() {
        return rValues.size();
    }

    public int statementBlockCount() {
        return statementBlocks.size();
    }

    private static <T> T require(T value, String kind, int id) {
        if (value == null) {
            throw new MissingEntityException(kind, id);
        }
        return value;
    }

    /**
     * Assembles a {@link Pack}. The {@code add*} methods allocate the next free id of their table,
     * starting at 1; the {@code put*} methods insert under a caller-chosen id, which is how
     * deserialized packs keep their original numbering. The sentinel id is never accepted.
     */
    public static final class Builder {

        private final Map<TypeId, Type> types = new HashMap<>();
        private final Map<FunctionId, String> functionNames = new HashMap<>();
        private final Map<RValueId, RValue> rValues = new HashMap<>();
        private final Map<GlobalSymbolId, GlobalSymbol> globalSymbols = new HashMap<>();
        private final Map<StatementBlockId, List<Statement>> statementBlocks = new HashMap<>();
        private final Map<FunctionId, FunctionDefinition> functionDefinitions = new HashMap<>();
        private final List<FunctionId> functionPrototypes = new ArrayList<>();
        private final List<FunctionId> functionDefinitionOrder = new ArrayList<>();

        private int nextTypeId = 1;
        private int nextFunctionId = 1;
        private int nextRValueId = 1;
        private int nextGlobalSymbolId = 1;
        private int nextStatementBlockId = 1;

        private Builder() {
        }

        public TypeId addType(Type type) {
            TypeId id = new TypeId(nextTypeId);
            putType(id, type);
            return id;
        }

        public Builder putType(TypeId id, Type type) {
            checkValid(id.isValid(), id);
            types.put(id, type);
            nextTypeId = Math.max(nextTypeId, id.id() + 1);
            return this;
        }

        /**
         * @param mangledName The function name followed by its parameter signature, e.g.
         *                    {@code "shade(vf3;f1;"}.
         */
        public FunctionId addFunctionName(String mangledName) {
            FunctionId id = new FunctionId(nextFunctionId);
            putFunctionName(id, mangledName);
            return id;
        }

        public Builder putFunctionName(FunctionId id, String mangledName) {
            checkValid(id.isValid(), id);
            functionNames.put(id, mangledName);
            nextFunctionId = Math.max(nextFunctionId, id.id() + 1);
            return this;
        }

        public RValueId addRValue(RValue rValue) {
            RValueId id = new RValueId(nextRValueId);
            putRValue(id, rValue);
            return id;
        }

        public Builder putRValue(RValueId id, RValue rValue) {
            checkValid(id.isValid(), id);
            rValues.put(id, rValue);
            nextRValueId = Math.max(nextRValueId, id.id() + 1);
            return this;
        }

        public GlobalSymbolId addGlobalSymbol(GlobalSymbol symbol) {
            GlobalSymbolId id = new GlobalSymbolId(nextGlobalSymbolId);
            putGlobalSymbol(id, symbol);
            return id;
        }

        public Builder putGlobalSymbol(GlobalSymbolId id, GlobalSymbol symbol) {
            checkValid(id.isValid(), id);
            globalSymbols.put(id, symbol);
            nextGlobalSymbolId = Math.max(nextGlobalSymbolId, id.id() + 1);
            return this;
        }

        public StatementBlockId addStatementBlock(List<Statement> statements) {
            StatementBlockId id = new StatementBlockId(nextStatementBlockId);
            putStatementBlock(id, statements);
            return id;
        }

        public StatementBlockId addStatementBlock(Statement... statements) {
            return addStatementBlock(List.of(statements));
        }

        public Builder putStatementBlock(StatementBlockId id, List<Statement> statements) {
            checkValid(id.isValid(), id);
            statementBlocks.put(id, statements);
            nextStatementBlockId = Math.max(nextStatementBlockId, id.id() + 1);
            return this;
        }

        /**
         * Registers a definition under its {@link FunctionDefinition#name()}. Does not add it to
         * the definition order.
         */
        public Builder putFunctionDefinition(FunctionDefinition definition) {
            checkValid(definition.name().isValid(), definition.name());
            functionDefinitions.put(definition.name(), definition);
            return this;
        }

        public Builder addPrototype(FunctionId id) {
            functionPrototypes.add(id);
            return this;
        }

        public Builder addToDefinitionOrder(FunctionId id) {
            functionDefinitionOrder.add(id);
            return this;
        }

        public Pack build() {
            return new Pack(this);
        }

        private static void checkValid(boolean valid, Object id) {
            if (!valid) {
                throw new IllegalArgumentException("The sentinel id cannot be inserted into a table: " + id);
            }
        }
    }
}
