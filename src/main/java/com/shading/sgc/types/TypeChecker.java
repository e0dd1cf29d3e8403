package com.shading.sgc.types;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.NodeKind;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.Signature;
import com.shading.sgc.api.SignatureTable;
import com.shading.sgc.error.MalformedConditionalException;
import com.shading.sgc.error.TypeCheckException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validates operands against a {@link SignatureTable} and infers result types.
 *
 * The checker runs eagerly at node construction: if it throws, the node is
 * never created. Apart from exact matches it knows a single implicit
 * conversion: an int literal is accepted where a float is expected (and is
 * later rendered in float form).
 *
 * Instances hold no mutable state and may be shared between threads.
 */
public final class TypeChecker {
    private final SignatureTable table;

    public TypeChecker(SignatureTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public SignatureTable table() {
        return table;
    }

    /**
     * Returns the result type of applying the operator to operands of the given
     * types. Only exact matches are considered since no literal information is
     * available here.
     *
     * @throws TypeCheckException if no overload accepts the types.
     */
    public ShaderType check(String operator, List<ShaderType> operandTypes) {
        List<Signature> candidates = candidates(operator, operandTypes);
        for (Signature s : candidates) {
            if (s.parameters().equals(operandTypes))
                return s.result();
        }
        throw mismatch(operator, operandTypes, List.of(), candidates);
    }

    /**
     * Selects the overload used to build an operator node over the given operands.
     *
     * Exact matches win; otherwise the first overload (in table order) that
     * accepts the operands once int literals are promoted to float.
     *
     * @throws TypeCheckException if no overload accepts the operands.
     */
    public Signature resolve(String operator, List<? extends Node> operands) {
        List<ShaderType> types = new ArrayList<>(operands.size());
        for (Node n : operands)
            types.add(Objects.requireNonNull(n, "operand").type());

        List<Signature> candidates = candidates(operator, types);
        for (Signature s : candidates) {
            if (s.parameters().equals(types))
                return s;
        }
        for (Signature s : candidates) {
            if (acceptsWithPromotion(s, operands))
                return s;
        }
        throw mismatch(operator, types, operands, candidates);
    }

    /**
     * Returns true if an operand of the given node may stand where {@code expected}
     * is required: same type, or an int literal in a float position.
     */
    public static boolean assignable(Node operand, ShaderType expected) {
        return operand.type() == expected || isPromotable(operand, expected);
    }

    /** True if the node is an int literal and the expected type is float. */
    public static boolean isPromotable(Node operand, ShaderType expected) {
        return expected == ShaderType.FLOAT
                && operand.kind() == NodeKind.LITERAL
                && operand.type() == ShaderType.INT;
    }

    /**
     * Checks the operands of an expression-valued conditional and returns its
     * result type.
     *
     * @throws MalformedConditionalException if the condition is not bool, the
     *                                       branches do not unify, or the
     *                                       branches are samplers.
     */
    public static ShaderType checkConditional(Node condition, Node whenTrue, Node whenFalse) {
        List<ShaderType> types = List.of(condition.type(), whenTrue.type(), whenFalse.type());
        if (condition.type() != ShaderType.BOOL)
            throw new MalformedConditionalException(
                    "Condition #" + condition.id() + " must be bool, got " + condition.type(), types);

        ShaderType result;
        if (whenTrue.type() == whenFalse.type())
            result = whenTrue.type();
        else if (isPromotable(whenTrue, whenFalse.type()))
            result = whenFalse.type();
        else if (isPromotable(whenFalse, whenTrue.type()))
            result = whenTrue.type();
        else
            throw new MalformedConditionalException("Branches #" + whenTrue.id() + " (" + whenTrue.type()
                    + ") and #" + whenFalse.id() + " (" + whenFalse.type() + ") do not unify", types);

        if (result.isSampler())
            throw new MalformedConditionalException("Conditional cannot select a sampler", types);
        return result;
    }

    private List<Signature> candidates(String operator, List<ShaderType> types) {
        List<Signature> all = table.signatures(operator);
        if (all.isEmpty())
            throw new TypeCheckException("Unknown operator '" + operator + "' in dialect " + table.dialect(),
                    operator, types);
        return all.stream().filter(s -> s.arity() == types.size()).toList();
    }

    private static boolean acceptsWithPromotion(Signature s, List<? extends Node> operands) {
        for (int i = 0; i < operands.size(); i++) {
            if (!assignable(operands.get(i), s.parameters().get(i)))
                return false;
        }
        return true;
    }

    private TypeCheckException mismatch(String operator, List<ShaderType> types, List<? extends Node> operands,
            List<Signature> candidates) {
        StringBuilder sb = new StringBuilder(128)
                .append("No overload of '").append(operator).append("' accepts ")
                .append(types.stream().map(ShaderType::glslName).collect(Collectors.joining(", ", "(", ")")));
        if (!operands.isEmpty())
            sb.append(" from operands ")
                    .append(operands.stream().map(n -> "#" + n.id()).collect(Collectors.joining(", ")));
        if (!candidates.isEmpty()) {
            sb.append("; candidates: ");
            int shown = Math.min(candidates.size(), 8);
            for (int i = 0; i < shown; i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(candidates.get(i));
            }
            if (candidates.size() > shown)
                sb.append(", ...");
        }
        return new TypeCheckException(sb.toString(), operator, types);
    }
}
