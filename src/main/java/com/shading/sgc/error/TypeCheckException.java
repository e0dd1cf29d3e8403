package com.shading.sgc.error;

import com.shading.sgc.api.ShaderType;

import java.util.List;

/**
 * No overload of an operator accepts the given operand types.
 *
 * Raised at node construction: the node is simply never created.
 */
public class TypeCheckException extends ShaderCompileException {
    private final String operator;
    private final List<ShaderType> operandTypes;

    public TypeCheckException(String message, String operator, List<ShaderType> operandTypes) {
        this(message, operator, operandTypes, NO_NODE);
    }

    public TypeCheckException(String message, String operator, List<ShaderType> operandTypes, long nodeId) {
        super(message, nodeId);
        this.operator = operator;
        this.operandTypes = List.copyOf(operandTypes);
    }

    public String operator() {
        return operator;
    }

    public List<ShaderType> operandTypes() {
        return operandTypes;
    }
}
