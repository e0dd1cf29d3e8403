package com.shading.sgc.api;

/**
 * The kinds of external binding a shader can read.
 */
public enum VariableKind {
    /** Read-only, per-invocation input (vertex attribute). */
    ATTRIBUTE("attribute"),
    /** Read-only, per-program input. */
    UNIFORM("uniform"),
    /** Per-invocation value passed between pipeline stages. */
    VARYING("varying");

    private final String qualifier;

    VariableKind(String qualifier) {
        this.qualifier = qualifier;
    }

    /** The GLSL storage qualifier used in declarations. */
    public String qualifier() {
        return qualifier;
    }

    public static VariableKind fromString(String text) {
        for (VariableKind k : values()) {
            if (k.name().equalsIgnoreCase(text))
                return k;
        }
        throw new IllegalArgumentException("Unknown VariableKind: " + text);
    }
}
