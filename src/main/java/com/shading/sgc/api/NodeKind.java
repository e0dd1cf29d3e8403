package com.shading.sgc.api;

/** Tag distinguishing the node variants of an expression graph. */
public enum NodeKind {
    LITERAL,
    OPERATOR,
    VARIABLE,
    CONDITIONAL
}
