package com.shading.sgc.io;

/**
 * Node types of a JSON shader graph definition.
 */
public enum NodeType {
    ATTRIBUTE,
    UNIFORM,
    VARYING,
    LITERAL,
    OPERATOR,
    CONDITIONAL,
    /** Placeholder expanded into a template's nodes before resolution. */
    TEMPLATE;

    public static NodeType fromString(String text) {
        for (NodeType b : NodeType.values()) {
            if (b.name().equalsIgnoreCase(text)) {
                return b;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }
}
