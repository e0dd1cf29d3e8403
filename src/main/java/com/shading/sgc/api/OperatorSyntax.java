package com.shading.sgc.api;

/** How an operator is spelled in the target language. */
public enum OperatorSyntax {
    /** {@code a + b} */
    INFIX,
    /** {@code -a}, {@code !a} */
    PREFIX,
    /** {@code sin(a)}, {@code vec3(a, b, c)} */
    CALL,
    /** {@code a.xyz}; the operator symbol carries the leading dot. */
    FIELD
}
