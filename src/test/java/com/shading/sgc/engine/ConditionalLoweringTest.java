package com.shading.sgc.engine;

import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.VariableKind;
import com.shading.sgc.node.ConditionalNode;
import com.shading.sgc.node.LiteralNode;
import com.shading.sgc.node.OperatorNode;
import com.shading.sgc.node.VariableNode;
import com.shading.sgc.types.GlslSignatureTable;
import com.shading.sgc.types.TypeChecker;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ConditionalLoweringTest {

    private final TypeChecker checker = new TypeChecker(GlslSignatureTable.glslEs100());
    private final ConditionalLowering lowering = new ConditionalLowering();

    @Test
    public void testLowerSingleConditional() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var cond = OperatorNode.create(checker, "<", List.of(a, LiteralNode.ofFloat(0.5)));
        var one = LiteralNode.ofFloat(1.0);
        var c = ConditionalNode.create(cond, one, a);

        Statement.ConditionalBlock block = lowering.lower(c, "t0");

        assertEquals("t0", block.temporary());
        assertSame(cond, block.condition());
        assertSame(one, block.whenTrue());
        assertSame(a, block.whenFalse());
        assertEquals(ShaderType.FLOAT, block.type());
    }

    @Test
    public void testLowerAllInEvaluationOrder() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var s = OperatorNode.create(checker, "sin", List.of(a));
        var positive = OperatorNode.create(checker, ">", List.of(s, LiteralNode.ofFloat(0.0)));
        var c = ConditionalNode.create(positive, s, LiteralNode.ofFloat(0.0));

        Analysis analysis = new GraphAnalyzer().analyze(List.of(c));
        List<Statement> statements = lowering.lowerAll(analysis, Map.of(s.id(), "t0", c.id(), "t1"));

        assertEquals(2, statements.size());
        assertTrue(statements.get(0) instanceof Statement.Binding);
        assertSame(s, statements.get(0).node());
        assertTrue(statements.get(1) instanceof Statement.ConditionalBlock);
        assertEquals("t1", statements.get(1).temporary());
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingTemporary() {
        var c = ConditionalNode.create(LiteralNode.ofBool(true), LiteralNode.ofInt(1), LiteralNode.ofInt(2));
        Analysis analysis = new GraphAnalyzer().analyze(List.of(c));
        lowering.lowerAll(analysis, Map.of());
    }
}
