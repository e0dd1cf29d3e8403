package com.shading.sgc.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One typed overload of an operator.
 *
 * @param operator   Operator symbol as it appears in source ({@code "+"},
 *                   {@code "sin"}, {@code "vec3"}, {@code ".xy"}).
 * @param syntax     How the operator is spelled.
 * @param precedence Binding strength used to decide parenthesization; higher
 *                   binds tighter. Calls and field access use
 *                   {@link #POSTFIX}.
 * @param parameters Operand types, in order.
 * @param result     Result type.
 */
public record Signature(String operator, OperatorSyntax syntax, int precedence,
        List<ShaderType> parameters, ShaderType result) {

    /** Precedence of literals, variables and temporaries. */
    public static final int ATOMIC = 17;
    /** Precedence of calls and field selection. */
    public static final int POSTFIX = 16;
    /** Precedence of prefix operators. */
    public static final int UNARY = 15;

    public Signature {
        parameters = List.copyOf(parameters);
    }

    public static Signature call(String operator, ShaderType result, ShaderType... parameters) {
        return new Signature(operator, OperatorSyntax.CALL, POSTFIX, List.of(parameters), result);
    }

    public static Signature infix(String operator, int precedence, ShaderType result,
            ShaderType left, ShaderType right) {
        return new Signature(operator, OperatorSyntax.INFIX, precedence, List.of(left, right), result);
    }

    public static Signature prefix(String operator, ShaderType result, ShaderType operand) {
        return new Signature(operator, OperatorSyntax.PREFIX, UNARY, List.of(operand), result);
    }

    public static Signature field(String operator, ShaderType result, ShaderType operand) {
        return new Signature(operator, OperatorSyntax.FIELD, POSTFIX, List.of(operand), result);
    }

    public int arity() {
        return parameters.size();
    }

    @Override
    public String toString() {
        return operator + parameters.stream().map(ShaderType::glslName)
                .collect(Collectors.joining(", ", "(", ")")) + " -> " + result.glslName();
    }
}
