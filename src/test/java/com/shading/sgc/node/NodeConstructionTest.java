package com.shading.sgc.node;

import com.shading.sgc.api.NodeKind;
import com.shading.sgc.api.Precision;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.VariableKind;
import com.shading.sgc.error.TypeCheckException;
import com.shading.sgc.types.GlslSignatureTable;
import com.shading.sgc.types.TypeChecker;
import org.junit.Test;

import java.util.*;
import java.util.concurrent.*;

import static org.junit.Assert.*;

public class NodeConstructionTest {

    private final TypeChecker checker = new TypeChecker(GlslSignatureTable.glslEs100());

    @Test
    public void testLiteralTypes() {
        assertEquals(ShaderType.FLOAT, LiteralNode.ofFloat(0.5).type());
        assertEquals(ShaderType.INT, LiteralNode.ofInt(3).type());
        assertEquals(ShaderType.BOOL, LiteralNode.ofBool(true).type());
        assertEquals(NodeKind.LITERAL, LiteralNode.ofInt(3).kind());
        assertTrue(LiteralNode.ofInt(3).operands().isEmpty());
        assertEquals(3, LiteralNode.ofInt(3).intValue());
        assertEquals(3.0, LiteralNode.ofInt(3).floatValue(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNLiteralRejected() {
        LiteralNode.ofFloat(Double.NaN);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInfiniteLiteralRejected() {
        LiteralNode.ofFloat(Double.POSITIVE_INFINITY);
    }

    @Test(expected = IllegalStateException.class)
    public void testIntValueOfFloatLiteral() {
        LiteralNode.ofFloat(1.5).intValue();
    }

    @Test
    public void testVariableValidation() {
        var v = new VariableNode(VariableKind.VARYING, "v_Uv", ShaderType.VEC2, Precision.HIGHP);
        assertEquals("v_Uv", v.name());
        assertEquals(Precision.HIGHP, v.precision());
        assertEquals(NodeKind.VARIABLE, v.kind());

        assertThrows(IllegalArgumentException.class,
                () -> new VariableNode(VariableKind.UNIFORM, "2bad", ShaderType.FLOAT));
        assertThrows(IllegalArgumentException.class,
                () -> new VariableNode(VariableKind.UNIFORM, "gl_Thing", ShaderType.FLOAT));
        assertThrows(IllegalArgumentException.class,
                () -> new VariableNode(VariableKind.UNIFORM, "u_X", ShaderType.FLOAT, Precision.LOWP));
        assertThrows(IllegalArgumentException.class,
                () -> new VariableNode(VariableKind.ATTRIBUTE, "a_Tex", ShaderType.SAMPLER_2D));
        assertThrows(IllegalArgumentException.class,
                () -> new VariableNode(VariableKind.ATTRIBUTE, "a_Index", ShaderType.INT));

        // Uniforms may be int, bool or samplers
        new VariableNode(VariableKind.UNIFORM, "u_Count", ShaderType.INT);
        new VariableNode(VariableKind.UNIFORM, "u_Tex", ShaderType.SAMPLER_2D);
    }

    @Test
    public void testReservedIdentifiersRejected() {
        for (String name : List.of("input", "output", "float", "vec3", "main", "if", "sin", "texture2D", "a__b")) {
            assertThrows(name, IllegalArgumentException.class,
                    () -> new VariableNode(VariableKind.UNIFORM, name, ShaderType.FLOAT));
        }
        // close to a reserved word is fine
        assertEquals("u_input", new VariableNode(VariableKind.UNIFORM, "u_input", ShaderType.FLOAT).name());
        assertEquals("vec5", new VariableNode(VariableKind.UNIFORM, "vec5", ShaderType.FLOAT).name());
    }

    @Test
    public void testSameBinding() {
        var a = new VariableNode(VariableKind.UNIFORM, "u_Color", ShaderType.VEC4);
        var b = new VariableNode(VariableKind.UNIFORM, "u_Color", ShaderType.VEC4);
        var c = new VariableNode(VariableKind.UNIFORM, "u_Color", ShaderType.VEC3);
        assertTrue(a.sameBinding(b));
        assertFalse(a.sameBinding(c));
        assertNotEquals(a.id(), b.id());
        assertNotEquals(a, b); // identity, not content
    }

    @Test
    public void testOperatorCarriesSignature() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.VEC3);
        var n = OperatorNode.create(checker, "normalize", List.of(a));
        assertEquals(ShaderType.VEC3, n.type());
        assertEquals("normalize", n.operator());
        assertEquals(List.of(ShaderType.VEC3), n.signature().parameters());
        assertSame(a, n.operands().get(0));
    }

    @Test(expected = TypeCheckException.class)
    public void testOperatorRejectsBadOperands() {
        OperatorNode.create(checker, "sin", List.of(LiteralNode.ofBool(true)));
    }

    @Test
    public void testConditionalOperandOrder() {
        var cond = LiteralNode.ofBool(false);
        var t = LiteralNode.ofFloat(1.0);
        var e = LiteralNode.ofFloat(2.0);
        var c = ConditionalNode.create(cond, t, e);
        assertEquals(List.of(cond, t, e), c.operands());
        assertEquals(ShaderType.FLOAT, c.type());
        assertEquals(NodeKind.CONDITIONAL, c.kind());
    }

    @Test
    public void testIdsUniqueAcrossThreads() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < 1000; i++)
                        ids.add(LiteralNode.ofInt(i).id());
                    return ids;
                }));
            }
            Set<Long> all = new HashSet<>();
            for (Future<List<Long>> f : futures)
                all.addAll(f.get());
            assertEquals(4000, all.size());
        } finally {
            pool.shutdown();
        }
    }
}
