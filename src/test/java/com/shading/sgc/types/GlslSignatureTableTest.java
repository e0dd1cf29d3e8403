package com.shading.sgc.types;

import com.shading.sgc.api.OperatorSyntax;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.Signature;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GlslSignatureTableTest {

    private final GlslSignatureTable table = GlslSignatureTable.glslEs100();

    @Test
    public void testDialect() {
        assertEquals("glsl-es-100", table.dialect());
        assertSame(table, GlslSignatureTable.glslEs100());
    }

    @Test
    public void testUnknownOperatorHasNoSignatures() {
        assertTrue(table.signatures("frobnicate").isEmpty());
        assertTrue(table.signatures(".xg").isEmpty()); // mixed component sets
        assertTrue(table.signatures(".xyzwx").isEmpty());
    }

    @Test
    public void testSwizzleSignatures() {
        List<Signature> xy = table.signatures(".xy");
        assertFalse(xy.isEmpty());
        for (Signature s : xy) {
            assertEquals(OperatorSyntax.FIELD, s.syntax());
            assertEquals(2, s.result().width());
            assertEquals(s.parameters().get(0).componentType(), s.result().componentType());
        }
        // .z needs at least three components
        assertTrue(table.signatures(".z").stream()
                .noneMatch(s -> s.parameters().get(0) == ShaderType.VEC2));
        assertTrue(table.signatures(".rgba").stream()
                .allMatch(s -> s.parameters().get(0).width() == 4));
    }

    @Test
    public void testPrecedences() {
        Signature mul = table.signatures("*").get(0);
        Signature add = table.signatures("+").get(0);
        Signature and = table.signatures("&&").get(0);
        assertTrue(mul.precedence() > add.precedence());
        assertTrue(add.precedence() > and.precedence());
        assertEquals(Signature.POSTFIX, table.signatures("sin").get(0).precedence());
    }

    @Test
    public void testCompositions() {
        assertEquals(4, GlslSignatureTable.compositions(ShaderType.FLOAT, 3).size());
        assertEquals(8, GlslSignatureTable.compositions(ShaderType.FLOAT, 4).size());
        assertTrue(GlslSignatureTable.compositions(ShaderType.FLOAT, 4)
                .contains(List.of(ShaderType.VEC2, ShaderType.VEC2)));
    }

    @Test
    public void testSupports() {
        Signature sin = table.signatures("sin").get(0);
        assertTrue(table.supports(sin));
        assertFalse(table.supports(Signature.call("sin", ShaderType.INT, ShaderType.INT)));
        assertFalse(table.supports(Signature.call("noise1", ShaderType.FLOAT, ShaderType.FLOAT)));
    }

    @Test
    public void testNoSamplerEquality() {
        assertTrue(table.signatures("==").stream()
                .noneMatch(s -> s.parameters().get(0).isSampler()));
    }

    @Test
    public void testOperatorsListed() {
        List<String> ops = table.operators();
        assertTrue(ops.contains("+"));
        assertTrue(ops.contains("texture2D"));
        assertTrue(ops.contains("mat4"));
    }
}
