package com.shading.sgc.node;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.NodeKind;
import com.shading.sgc.api.Signature;
import com.shading.sgc.types.TypeChecker;

import java.util.List;

/**
 * Application of an operator, built-in function or constructor to operands.
 *
 * Only {@link #create} builds these nodes, so every operator node carries the
 * overload its operands were checked against.
 */
public final class OperatorNode extends AbstractNode {
    private final Signature signature;
    private final List<Node> operands;

    private OperatorNode(Signature signature, List<Node> operands) {
        super(signature.result());
        this.signature = signature;
        this.operands = operands;
    }

    /**
     * Type-checks the operands and builds the node.
     *
     * @throws com.shading.sgc.error.TypeCheckException if no overload accepts
     *                                                  the operands.
     */
    public static OperatorNode create(TypeChecker checker, String operator, List<? extends Node> operands) {
        List<Node> ops = List.copyOf(operands);
        return new OperatorNode(checker.resolve(operator, ops), ops);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPERATOR;
    }

    @Override
    public List<Node> operands() {
        return operands;
    }

    public String operator() {
        return signature.operator();
    }

    /** The overload selected at construction. */
    public Signature signature() {
        return signature;
    }

    @Override
    public String toString() {
        return super.toString() + "[" + signature.operator() + "]";
    }
}
