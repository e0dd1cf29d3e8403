package com.shading.sgc.emit;

import com.shading.sgc.api.ShaderType;
import com.shading.sgc.node.LiteralNode;

/**
 * Lexical forms of literals. Float literals always carry a decimal point or an
 * exponent so they never read as ints.
 */
public final class LiteralFormat {
    private LiteralFormat() {
        // Utility class
    }

    /**
     * Renders a literal standing where a value of {@code expected} type is
     * required. An int literal in a float position is written in float form.
     */
    public static String format(LiteralNode literal, ShaderType expected) {
        return switch (literal.type()) {
            case BOOL -> Boolean.toString(literal.booleanValue());
            case INT -> expected == ShaderType.FLOAT
                    ? literal.intValue() + ".0"
                    : Integer.toString(literal.intValue());
            case FLOAT -> formatFloat(literal.floatValue());
            default -> throw new IllegalStateException("Literal of non-scalar type " + literal.type());
        };
    }

    /**
     * {@code 1.0}, {@code 0.25}, {@code -3.5}, {@code 1.0E-7}.
     */
    public static String formatFloat(double value) {
        // Double.toString always emits a '.' and uses E-notation outside [1e-3, 1e7)
        return Double.toString(value);
    }
}
