package com.shading.sgc.engine;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.NodeKind;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.VariableKind;
import com.shading.sgc.error.UnsupportedConstructException;
import com.shading.sgc.node.ConditionalNode;
import com.shading.sgc.node.LiteralNode;
import com.shading.sgc.node.OperatorNode;
import com.shading.sgc.node.VariableNode;
import com.shading.sgc.types.GlslSignatureTable;
import com.shading.sgc.types.TypeChecker;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphAnalyzerTest {

    private final TypeChecker checker = new TypeChecker(GlslSignatureTable.glslEs100());
    private final GraphAnalyzer analyzer = new GraphAnalyzer();

    private OperatorNode op(String operator, Node... operands) {
        return OperatorNode.create(checker, operator, List.of(operands));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyRoots() {
        analyzer.analyze(List.of());
    }

    @Test
    public void testSingleNode() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        Analysis analysis = analyzer.analyze(List.of(a));

        assertEquals(1, analysis.nodeCount());
        assertEquals(1, analysis.referenceCount(a));
        assertFalse(analysis.isMaterialized(a));
        assertTrue(analysis.materializedInOrder().isEmpty());
    }

    @Test
    public void testLinearGraph() {
        // a -> sin -> cos
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var s = op("sin", a);
        var c = op("cos", s);

        Analysis analysis = analyzer.analyze(List.of(c));

        assertEquals(List.of(c, s, a), analysis.discoveryOrder());
        assertEquals(List.of(a, s, c), analysis.evaluationOrder());
        assertEquals(1, analysis.referenceCount(s));
        assertTrue(analysis.materializedInOrder().isEmpty());
    }

    @Test
    public void testTiesBrokenByDiscovery() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var b = new VariableNode(VariableKind.ATTRIBUTE, "b", ShaderType.FLOAT);
        var sa = op("sin", a);
        var cb = op("cos", b);
        var sum = op("+", sa, cb);

        Analysis analysis = analyzer.analyze(List.of(sum));

        assertEquals(List.of(sum, sa, a, cb, b), analysis.discoveryOrder());
        assertEquals(List.of(a, sa, b, cb, sum), analysis.evaluationOrder());
    }

    @Test
    public void testDiamondGraph() {
        // v
        // |
        // length
        // / | \
        // vec3
        var v = new VariableNode(VariableKind.UNIFORM, "v", ShaderType.VEC3);
        var len = op("length", v);
        var splat = op("vec3", len, len, len);

        Analysis analysis = analyzer.analyze(List.of(splat));

        assertEquals(3, analysis.nodeCount());
        assertEquals(3, analysis.referenceCount(len));
        assertTrue(analysis.isMaterialized(len));
        assertFalse(analysis.isMaterialized(splat));
        assertFalse(analysis.isMaterialized(v));
        assertEquals(List.of(len), analysis.materializedInOrder());
    }

    @Test
    public void testSharedLeavesNeverMaterialized() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var half = LiteralNode.ofFloat(0.5);
        var sum = op("+", op("*", a, half), op("-", a, half));

        Analysis analysis = analyzer.analyze(List.of(sum));

        assertEquals(2, analysis.referenceCount(a));
        assertEquals(2, analysis.referenceCount(half));
        assertTrue(analysis.materializedInOrder().isEmpty());
    }

    @Test
    public void testConditionalAlwaysMaterialized() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var c = ConditionalNode.create(op(">", a, LiteralNode.ofFloat(0.0)), a, LiteralNode.ofFloat(0.0));

        Analysis analysis = analyzer.analyze(List.of(c));

        assertEquals(1, analysis.referenceCount(c));
        assertTrue(analysis.isMaterialized(c));
    }

    @Test
    public void testSharingAcrossRoots() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var s = op("sin", a);
        var r1 = op("cos", s);
        var r2 = op("abs", s);

        Analysis analysis = analyzer.analyze(List.of(r1, r2));

        assertEquals(4, analysis.nodeCount());
        assertEquals(2, analysis.referenceCount(s));
        assertEquals(List.of(s), analysis.materializedInOrder());
    }

    @Test
    public void testRootSlotCounts() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        var s = op("sin", a);
        var c = op("cos", s);

        Analysis analysis = analyzer.analyze(List.of(s, c));

        assertEquals(2, analysis.referenceCount(s));
        assertTrue(analysis.isMaterialized(s));
        assertFalse(analysis.isMaterialized(c));
    }

    @Test
    public void testDependenciesFirst() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.VEC3);
        var n = op("normalize", a);
        var d = op("dot", n, n);
        var root = op("*", n, op("max", d, LiteralNode.ofFloat(0.0)));

        List<Node> order = analyzer.analyze(List.of(root)).evaluationOrder();
        for (Node node : order)
            for (Node operand : node.operands())
                assertTrue(order.indexOf(operand) < order.indexOf(node));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReferenceCountOfForeignNode() {
        var a = new VariableNode(VariableKind.ATTRIBUTE, "a", ShaderType.FLOAT);
        analyzer.analyze(List.of(a)).referenceCount(LiteralNode.ofInt(1));
    }

    @Test(expected = UnsupportedConstructException.class)
    public void testUnknownNodeImplementation() {
        Node alien = new Node() {
            @Override
            public long id() {
                return -42;
            }

            @Override
            public NodeKind kind() {
                return NodeKind.OPERATOR;
            }

            @Override
            public ShaderType type() {
                return ShaderType.FLOAT;
            }

            @Override
            public List<Node> operands() {
                return List.of();
            }
        };
        analyzer.analyze(List.of(alien));
    }
}
