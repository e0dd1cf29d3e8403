package com.shading.sgc.error;

import com.shading.sgc.api.ShaderType;

import java.util.List;

/**
 * A conditional whose test is not boolean or whose branches do not unify.
 */
public class MalformedConditionalException extends TypeCheckException {
    public static final String OPERATOR = "?:";

    public MalformedConditionalException(String message, List<ShaderType> operandTypes) {
        super(message, OPERATOR, operandTypes);
    }
}
