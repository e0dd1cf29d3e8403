package com.shading.sgc.types;

import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.Signature;
import com.shading.sgc.api.VariableKind;
import com.shading.sgc.error.MalformedConditionalException;
import com.shading.sgc.error.TypeCheckException;
import com.shading.sgc.node.LiteralNode;
import com.shading.sgc.node.VariableNode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TypeCheckerTest {

    private final TypeChecker checker = new TypeChecker(GlslSignatureTable.glslEs100());

    @Test
    public void testSinPreservesType() {
        for (ShaderType t : List.of(ShaderType.FLOAT, ShaderType.VEC2, ShaderType.VEC3, ShaderType.VEC4))
            assertEquals(t, checker.check("sin", List.of(t)));
    }

    @Test(expected = TypeCheckException.class)
    public void testSinOfBoolFails() {
        checker.check("sin", List.of(ShaderType.BOOL));
    }

    @Test
    public void testMismatchCarriesOperatorAndTypes() {
        try {
            checker.check("dot", List.of(ShaderType.VEC2, ShaderType.VEC3));
            fail("Expected TypeCheckException");
        } catch (TypeCheckException e) {
            assertEquals("dot", e.operator());
            assertEquals(List.of(ShaderType.VEC2, ShaderType.VEC3), e.operandTypes());
            assertTrue(e.getMessage(), e.getMessage().contains("candidates"));
        }
    }

    @Test
    public void testUnknownOperator() {
        try {
            checker.check("frobnicate", List.of(ShaderType.FLOAT));
            fail("Expected TypeCheckException");
        } catch (TypeCheckException e) {
            assertTrue(e.getMessage().contains("Unknown operator"));
        }
    }

    @Test
    public void testResultTypes() {
        assertEquals(ShaderType.FLOAT, checker.check("length", List.of(ShaderType.VEC3)));
        assertEquals(ShaderType.FLOAT, checker.check("dot", List.of(ShaderType.VEC4, ShaderType.VEC4)));
        assertEquals(ShaderType.VEC4, checker.check("*", List.of(ShaderType.MAT4, ShaderType.VEC4)));
        assertEquals(ShaderType.VEC3, checker.check("*", List.of(ShaderType.VEC3, ShaderType.FLOAT)));
        assertEquals(ShaderType.BOOL, checker.check("<", List.of(ShaderType.FLOAT, ShaderType.FLOAT)));
        assertEquals(ShaderType.VEC4, checker.check("texture2D", List.of(ShaderType.SAMPLER_2D, ShaderType.VEC2)));
        assertEquals(ShaderType.VEC4, checker.check("vec4", List.of(ShaderType.VEC3, ShaderType.FLOAT)));
        assertEquals(ShaderType.VEC2, checker.check(".xy", List.of(ShaderType.VEC4)));
    }

    @Test
    public void testConversionConstructors() {
        assertEquals(ShaderType.VEC3, checker.check("vec3", List.of(ShaderType.IVEC3)));
        assertEquals(ShaderType.VEC4, checker.check("vec4", List.of(ShaderType.BVEC4)));
        assertEquals(ShaderType.IVEC2, checker.check("ivec2", List.of(ShaderType.VEC4)));
        assertEquals(ShaderType.FLOAT, checker.check("float", List.of(ShaderType.VEC3)));
        assertEquals(ShaderType.BOOL, checker.check("bool", List.of(ShaderType.IVEC2)));

        // narrower source and mixed-type compositions stay rejected
        assertThrows(TypeCheckException.class, () -> checker.check("vec4", List.of(ShaderType.IVEC3)));
        assertThrows(TypeCheckException.class,
                () -> checker.check("vec3", List.of(ShaderType.IVEC2, ShaderType.FLOAT)));
    }

    @Test
    public void testIntLiteralPromotedToFloat() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        Signature s = checker.resolve("clamp", List.of(a, LiteralNode.ofInt(0), LiteralNode.ofInt(1)));
        assertEquals(List.of(ShaderType.FLOAT, ShaderType.FLOAT, ShaderType.FLOAT), s.parameters());
        assertEquals(ShaderType.FLOAT, s.result());
    }

    @Test
    public void testExactMatchPreferredOverPromotion() {
        Signature s = checker.resolve("+", List.of(LiteralNode.ofInt(1), LiteralNode.ofInt(2)));
        assertEquals(ShaderType.INT, s.result());
    }

    @Test(expected = TypeCheckException.class)
    public void testIntVariableNotPromoted() {
        var n = new VariableNode(VariableKind.UNIFORM, "u_N", ShaderType.INT);
        checker.resolve("+", List.of(n, LiteralNode.ofFloat(1.0)));
    }

    @Test
    public void testConditionalTypes() {
        var cond = LiteralNode.ofBool(true);
        assertEquals(ShaderType.FLOAT,
                TypeChecker.checkConditional(cond, LiteralNode.ofFloat(1.0), LiteralNode.ofInt(0)));
        assertEquals(ShaderType.INT,
                TypeChecker.checkConditional(cond, LiteralNode.ofInt(1), LiteralNode.ofInt(0)));
    }

    @Test(expected = MalformedConditionalException.class)
    public void testConditionalNeedsBoolCondition() {
        TypeChecker.checkConditional(LiteralNode.ofFloat(1.0), LiteralNode.ofFloat(1.0), LiteralNode.ofFloat(2.0));
    }

    @Test(expected = MalformedConditionalException.class)
    public void testConditionalBranchesMustUnify() {
        var v2 = new VariableNode(VariableKind.VARYING, "v_A", ShaderType.VEC2);
        var v3 = new VariableNode(VariableKind.VARYING, "v_B", ShaderType.VEC3);
        TypeChecker.checkConditional(LiteralNode.ofBool(true), v2, v3);
    }

    @Test
    public void testMalformedConditionalIsTypeCheckError() {
        try {
            TypeChecker.checkConditional(LiteralNode.ofInt(1), LiteralNode.ofInt(1), LiteralNode.ofInt(2));
            fail("Expected MalformedConditionalException");
        } catch (TypeCheckException e) {
            assertEquals(MalformedConditionalException.OPERATOR, e.operator());
        }
    }
}
