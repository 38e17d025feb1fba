package org.glslregen.compiler.ir;

import org.glslregen.compiler.api.MissingEntityException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PackTest {

    @Test
    void builderAllocatesIdsFromOne() {
        Pack.Builder builder = Pack.builder();

        assertThat(builder.addType(Type.of("float"))).isEqualTo(new TypeId(1));
        assertThat(builder.addType(Type.of("int"))).isEqualTo(new TypeId(2));
        assertThat(builder.addGlobalSymbol(new GlobalSymbol("u"))).isEqualTo(new GlobalSymbolId(1));
        assertThat(builder.addStatementBlock()).isEqualTo(new StatementBlockId(1));
    }

    @Test
    void explicitIdsMoveTheAllocatorPastThem() {
        Pack.Builder builder = Pack.builder();
        builder.putRValue(new RValueId(10), new LiteralRValue(new Literal.IntLiteral(1)));

        assertThat(builder.addRValue(new LiteralRValue(new Literal.IntLiteral(2)))).isEqualTo(new RValueId(11));
    }

    @Test
    void sentinelCannotBeInserted() {
        Pack.Builder builder = Pack.builder();

        assertThatThrownBy(() -> builder.putType(TypeId.INVALID, Type.of("float")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.putStatementBlock(StatementBlockId.INVALID, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativeIdsAreRejected() {
        assertThatThrownBy(() -> new RValueId(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupsOfUnknownIdsThrowWithEntityKind() {
        Pack pack = Pack.builder().build();

        assertThatThrownBy(() -> pack.type(new TypeId(1))).isInstanceOf(MissingEntityException.class)
                .hasMessage("Missing type definition for id 1");
        assertThatThrownBy(() -> pack.statementBlock(new StatementBlockId(2)))
                .hasMessage("Missing statement block definition for id 2");
        assertThatThrownBy(() -> pack.functionName(new FunctionId(3)))
                .hasMessage("Missing function name definition for id 3");
        assertThat(pack.findFunctionDefinition(new FunctionId(3))).isEmpty();
    }

    @Test
    void builtPackIsDetachedFromBuilder() {
        Pack.Builder builder = Pack.builder();
        FunctionId main = builder.addFunctionName("main(");
        builder.addPrototype(main);
        Pack pack = builder.build();

        builder.addPrototype(main);

        assertThat(pack.functionPrototypes()).containsExactly(main);
        assertThatThrownBy(() -> pack.functionPrototypes().add(main))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void functionParametersMustBeLocals() {
        LocalSymbolId param = new LocalSymbolId(1);

        assertThatThrownBy(() -> new FunctionDefinition(new TypeId(1), new FunctionId(1), List.of(param),
                Map.of(), new StatementBlockId(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not in its local symbol table");
    }

    @Test
    void localSymbolsIterateInIdOrder() {
        TypeId t = new TypeId(1);
        FunctionDefinition function = new FunctionDefinition(t, new FunctionId(1), List.of(), Map.of(
                new LocalSymbolId(9), new LocalSymbol(t, "c"),
                new LocalSymbolId(2), new LocalSymbol(t, "a"),
                new LocalSymbolId(5), new LocalSymbol(t, "b")), new StatementBlockId(1));

        assertThat(function.localSymbols().values()).extracting(LocalSymbol::name).containsExactly("a", "b", "c");
    }

    @Test
    void operatorNamesRoundTrip() {
        assertThat(RValueOperator.ADD_ASSIGN.displayName()).isEqualTo("AddAssign");
        assertThat(RValueOperator.fromName("ConstructStruct")).isEqualTo(RValueOperator.CONSTRUCT_STRUCT);
        assertThat(RValueOperator.fromName("LOGICAL_XOR")).isEqualTo(RValueOperator.LOGICAL_XOR);
        assertThatThrownBy(() -> RValueOperator.fromName("Pow")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void branchOperatorLookupAcceptsKeywords() {
        assertThat(BranchOperator.fromName("terminateRayEXT")).isEqualTo(BranchOperator.TERMINATE_RAY_EXT);
        assertThat(BranchOperator.fromName("Return")).isEqualTo(BranchOperator.RETURN);
        assertThat(BranchOperator.CASE.isLabel()).isTrue();
        assertThat(BranchOperator.BREAK.isLabel()).isFalse();
    }
}
