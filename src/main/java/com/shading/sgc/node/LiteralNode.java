package com.shading.sgc.node;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.NodeKind;
import com.shading.sgc.api.ShaderType;

import java.util.List;

/**
 * A constant scalar: float, int or bool.
 *
 * Vector and matrix constants are built with constructor operators over
 * scalar literals, the way they are written in the target language.
 */
public final class LiteralNode extends AbstractNode {
    private final Object value;

    private LiteralNode(ShaderType type, Object value) {
        super(type);
        this.value = value;
    }

    /**
     * Creates a float literal.
     *
     * @throws IllegalArgumentException for NaN or infinite values, which have no
     *                                  literal form.
     */
    public static LiteralNode ofFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new IllegalArgumentException("Float literal must be finite: " + value);
        return new LiteralNode(ShaderType.FLOAT, value);
    }

    public static LiteralNode ofInt(int value) {
        return new LiteralNode(ShaderType.INT, value);
    }

    public static LiteralNode ofBool(boolean value) {
        return new LiteralNode(ShaderType.BOOL, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL;
    }

    @Override
    public List<Node> operands() {
        return List.of();
    }

    /** The boxed value: Double, Integer or Boolean depending on type. */
    public Object value() {
        return value;
    }

    public double floatValue() {
        return ((Number) value).doubleValue();
    }

    public int intValue() {
        if (!(value instanceof Integer i))
            throw new IllegalStateException("Not an int literal: " + this);
        return i;
    }

    public boolean booleanValue() {
        if (!(value instanceof Boolean b))
            throw new IllegalStateException("Not a bool literal: " + this);
        return b;
    }

    @Override
    public String toString() {
        return super.toString() + "=" + value;
    }
}
