package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.api.MalformedIrException;
import org.glslregen.compiler.api.MissingEntityException;
import org.glslregen.compiler.ir.FunctionDefinition;
import org.glslregen.compiler.ir.FunctionId;
import org.glslregen.compiler.ir.GlobalSymbol;
import org.glslregen.compiler.ir.GlobalSymbolId;
import org.glslregen.compiler.ir.Literal;
import org.glslregen.compiler.ir.LocalSymbolId;
import org.glslregen.compiler.ir.Pack;
import org.glslregen.compiler.ir.RValueId;
import org.glslregen.compiler.ir.RValueOperator;
import org.glslregen.compiler.ir.Type;
import org.glslregen.compiler.ir.TypeId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link ExpressionEmitter} and the operator shapes it delegates to.
 */
@Tag("unit")
class ExpressionEmitterTest {

    private IrFixture ir;
    private LocalSymbolId a;
    private LocalSymbolId b;

    @BeforeEach
    void setUp() {
        ir = new IrFixture();
        a = ir.local("a");
        b = ir.local("b");
    }

    @Test
    void binaryAddIsParenthesized() {
        assertThat(ir.expression(ir.op(RValueOperator.ADD, a, b))).isEqualTo("(a + b)");
    }

    @Test
    void ternaryParenthesizesEachOperand() {
        LocalSymbolId c = ir.local("c");
        LocalSymbolId d = ir.local("d");
        LocalSymbolId e = ir.local("e");

        assertThat(ir.expression(ir.op(RValueOperator.TERNARY, c, d, e))).isEqualTo("((c) ? (d) : (e))");
    }

    @Test
    void nestedBinaryOperatorsKeepTheirGrouping() {
        LocalSymbolId c = ir.local("c");
        RValueId sum = ir.op(RValueOperator.ADD, a, b);
        RValueId product = ir.op(RValueOperator.MUL, sum, c);
        RValueId assign = ir.op(RValueOperator.ASSIGN, a, product);

        assertThat(ir.expression(assign)).isEqualTo("(a = ((a + b) * c))");
    }

    @Test
    void compoundAssignmentAndLogicalOperatorsUseTheirTokens() {
        assertThat(ir.expression(ir.op(RValueOperator.RIGHT_SHIFT_ASSIGN, a, b))).isEqualTo("(a >>= b)");
        assertThat(ir.expression(ir.op(RValueOperator.LOGICAL_XOR, a, b))).isEqualTo("(a ^^ b)");
        assertThat(ir.expression(ir.op(RValueOperator.GREATER_THAN_EQUAL, a, b))).isEqualTo("(a >= b)");
        assertThat(ir.expression(ir.op(RValueOperator.COMMA, a, b))).isEqualTo("(a , b)");
    }

    @Test
    void unaryOperatorShapes() {
        assertThat(ir.expression(ir.op(RValueOperator.NEGATIVE, a))).isEqualTo("-(a)");
        assertThat(ir.expression(ir.op(RValueOperator.LOGICAL_NOT, a))).isEqualTo("!(a)");
        assertThat(ir.expression(ir.op(RValueOperator.BITWISE_NOT, a))).isEqualTo("~(a)");
        assertThat(ir.expression(ir.op(RValueOperator.PRE_INCREMENT, a))).isEqualTo("++a");
        assertThat(ir.expression(ir.op(RValueOperator.PRE_DECREMENT, a))).isEqualTo("--a");
        assertThat(ir.expression(ir.op(RValueOperator.POST_INCREMENT, a))).isEqualTo("a++");
        assertThat(ir.expression(ir.op(RValueOperator.POST_DECREMENT, a))).isEqualTo("a--");
        assertThat(ir.expression(ir.op(RValueOperator.ARRAY_LENGTH, a))).isEqualTo("a.length");
    }

    @Test
    void negatingANegationStaysUnambiguous() {
        RValueId inner = ir.op(RValueOperator.NEGATIVE, a);

        assertThat(ir.expression(ir.op(RValueOperator.NEGATIVE, inner))).isEqualTo("-(-(a))");
    }

    @Test
    void indexHasNoExtraParentheses() {
        assertThat(ir.expression(ir.op(RValueOperator.INDEX, a, ir.intLiteral(2)))).isEqualTo("a[2]");
    }

    @Test
    void unsetIndexRendersInvalidMarker() {
        assertThat(ir.expression(ir.op(RValueOperator.INDEX, a, RValueId.INVALID))).isEqualTo("a[INVALID_RVALUE]");
    }

    @Test
    void genericShapeListsDisplayNameAndArguments() {
        assertThat(ir.expression(ir.op(RValueOperator.CONSTRUCT_STRUCT, a, b))).isEqualTo("(ConstructStruct a b)");
        assertThat(ir.expression(ir.op(RValueOperator.CONSTRUCT_STRUCT))).isEqualTo("(ConstructStruct)");
    }

    @Test
    void functionCallStripsMangledSignature() {
        FunctionId shade = ir.builder.addFunctionName("shade(vf3;f1;");
        FunctionId seed = ir.builder.addFunctionName("seed(");

        assertThat(ir.expression(ir.call(shade, a, ir.op(RValueOperator.ADD, a, b)))).isEqualTo("shade(a, (a + b))");
        assertThat(ir.expression(ir.call(seed))).isEqualTo("seed()");
    }

    @Test
    void literalsRenderTheirPayload() {
        assertThat(ir.expression(ir.literal(new Literal.FloatLiteral(0.5f)))).isEqualTo("0.5");
        assertThat(ir.expression(ir.literal(new Literal.UintLiteral(7)))).isEqualTo("7u");
        assertThat(ir.expression(ir.op(RValueOperator.MUL, a, ir.intLiteral(-3)))).isEqualTo("(a * (-3))");
    }

    @Test
    void globalSymbolsResolveByName() {
        GlobalSymbolId color = ir.builder.addGlobalSymbol(new GlobalSymbol("uColor"));

        assertThat(ir.expression(ir.op(RValueOperator.MUL_ASSIGN, color, a))).isEqualTo("(uColor *= a)");
    }

    @Test
    void sentinelOperandsRenderMarkers() {
        assertThat(ir.expression(GlobalSymbolId.INVALID)).isEqualTo("INVALID_GLOBAL_SYMBOL");
        assertThat(ir.expression(LocalSymbolId.INVALID)).isEqualTo("INVALID_LOCAL_SYMBOL");
        assertThat(ir.expression(RValueId.INVALID)).isEqualTo("INVALID_RVALUE");
    }

    @Test
    void structFieldUsesMemberNameOfLocalType() {
        TypeId light = ir.builder.addType(new Type("", "Light", List.of(), List.of("position", "color")));
        LocalSymbolId sun = ir.local("sun", light);

        assertThat(ir.expression(ir.op(RValueOperator.INDEX_STRUCT, sun, ir.intLiteral(1)))).isEqualTo("sun.color");
    }

    @Test
    void structFieldThroughArrayElementUsesElementMembers() {
        TypeId lights = ir.builder.addType(new Type("", "Light", List.of(4), List.of("position", "color")));
        LocalSymbolId all = ir.local("lights", lights);
        RValueId element = ir.op(RValueOperator.INDEX, all, ir.intLiteral(2));

        assertThat(ir.expression(ir.op(RValueOperator.INDEX_STRUCT, element, ir.intLiteral(0))))
                .isEqualTo("lights[2].position");
    }

    @Test
    void nestedStructFieldFollowsMemberTypes() {
        TypeId vec3 = ir.builder.addType(Type.of("vec3"));
        TypeId material = ir.builder.addType(new Type("", "Material", List.of(), List.of("albedo", "color")));
        TypeId light = ir.builder.addType(new Type("", "Light", List.of(), List.of("position", "material"),
                List.of(vec3, material)));
        LocalSymbolId sun = ir.local("sun", light);
        RValueId sunMaterial = ir.op(RValueOperator.INDEX_STRUCT, sun, ir.intLiteral(1));

        assertThat(ir.expression(ir.op(RValueOperator.INDEX_STRUCT, sunMaterial, ir.intLiteral(1))))
                .isEqualTo("sun.material.color");
    }

    @Test
    void nestedStructFieldWithoutMemberTypesFallsBackToPositionalName() {
        TypeId light = ir.builder.addType(new Type("", "Light", List.of(), List.of("position", "material")));
        LocalSymbolId sun = ir.local("sun", light);
        RValueId sunMaterial = ir.op(RValueOperator.INDEX_STRUCT, sun, ir.intLiteral(1));

        assertThat(ir.expression(ir.op(RValueOperator.INDEX_STRUCT, sunMaterial, ir.intLiteral(0))))
                .isEqualTo("sun.material.field0");
    }

    @Test
    void structFieldOfUntypedBaseFallsBackToPositionalName() {
        GlobalSymbolId block = ir.builder.addGlobalSymbol(new GlobalSymbol("uMaterial"));

        assertThat(ir.expression(ir.op(RValueOperator.INDEX_STRUCT, block, ir.intLiteral(3)))).isEqualTo("uMaterial.field3");
    }

    @Test
    void swizzleMapsComponentsToXyzw() {
        RValueId xyz = ir.op(RValueOperator.VECTOR_SWIZZLE, a, ir.intLiteral(0), ir.intLiteral(1), ir.intLiteral(2));
        RValueId ww = ir.op(RValueOperator.VECTOR_SWIZZLE, a, ir.intLiteral(3), ir.intLiteral(3));

        assertThat(ir.expression(xyz)).isEqualTo("a.xyz");
        assertThat(ir.expression(ww)).isEqualTo("a.ww");
    }

    @Test
    void swizzleRejectsOutOfRangeComponent() {
        RValueId swizzle = ir.op(RValueOperator.VECTOR_SWIZZLE, a, ir.intLiteral(4));

        assertThatThrownBy(() -> ir.expression(swizzle))
                .isInstanceOf(MalformedIrException.class)
                .hasMessageContaining("VectorSwizzle");
    }

    @Test
    void swizzleRejectsNonLiteralSelector() {
        RValueId swizzle = ir.op(RValueOperator.VECTOR_SWIZZLE, a, b);

        assertThatThrownBy(() -> ir.expression(swizzle))
                .isInstanceOf(MalformedIrException.class)
                .hasMessageContaining("int literal");
    }

    @Test
    void swizzleWithoutComponentsIsMalformed() {
        RValueId swizzle = ir.op(RValueOperator.VECTOR_SWIZZLE, a);

        assertThatThrownBy(() -> ir.expression(swizzle)).isInstanceOf(MalformedIrException.class);
    }

    @Test
    void arityMismatchNamesTheOperator() {
        RValueId broken = ir.op(RValueOperator.ADD, a);

        assertThatThrownBy(() -> ir.expression(broken))
                .isInstanceOf(MalformedIrException.class)
                .hasMessageContaining("Add must be a binary operator");
    }

    @Test
    void ternaryWithTwoOperandsIsMalformed() {
        RValueId broken = ir.op(RValueOperator.TERNARY, a, b);

        assertThatThrownBy(() -> ir.expression(broken))
                .isInstanceOf(MalformedIrException.class)
                .hasMessageContaining("Ternary must be a ternary operator");
    }

    @Test
    void unknownRValueIsMissingEntity() {
        RValueId outer = ir.op(RValueOperator.ADD, a, new RValueId(99));

        assertThatThrownBy(() -> ir.expression(outer))
                .isInstanceOf(MissingEntityException.class)
                .hasMessageContaining("r-value");
    }

    @Test
    void unknownLocalSymbolIsMissingEntity() {
        MissingEntityException e = catchThrowableOfType(
                () -> ir.expression(new LocalSymbolId(42)), MissingEntityException.class);

        assertThat(e).isNotNull();
        assertThat(e.getEntityKind()).isEqualTo("local symbol");
        assertThat(e.getId()).isEqualTo(42);
    }

    @Test
    void sentinelRValueNeverTouchesThePack() {
        Pack pack = mock(Pack.class);
        SymbolPrinter symbols = mock(SymbolPrinter.class);
        StringBuilder out = new StringBuilder();

        new ExpressionEmitter(pack, symbols).emitRValue(mock(FunctionDefinition.class), RValueId.INVALID, out);

        assertThat(out).hasToString("INVALID_RVALUE");
        verifyNoInteractions(pack, symbols);
    }
}
