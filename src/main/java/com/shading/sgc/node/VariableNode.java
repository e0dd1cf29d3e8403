package com.shading.sgc.node;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.NodeKind;
import com.shading.sgc.api.Precision;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.VariableKind;
import com.shading.sgc.types.GlslReservedWords;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named external binding read by the shader: attribute, uniform or varying.
 *
 * Variables are created once by the caller and referenced, never mutated, by
 * downstream nodes. Name uniqueness is checked when a program is compiled.
 */
public final class VariableNode extends AbstractNode {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final VariableKind variableKind;
    private final String name;
    private final Precision precision;

    /**
     * @param variableKind Storage kind.
     * @param name         GLSL identifier, must not start with {@code gl_}.
     * @param type         Declared type.
     * @param precision    Optional precision qualifier; only varyings accept one.
     */
    public VariableNode(VariableKind variableKind, String name, ShaderType type, Precision precision) {
        super(Objects.requireNonNull(type, "type"));
        this.variableKind = Objects.requireNonNull(variableKind, "variableKind");
        this.name = requireIdentifier(name);
        this.precision = precision;

        if (precision != null && variableKind != VariableKind.VARYING)
            throw new IllegalArgumentException(
                    "Precision qualifier only allowed on varyings, got " + variableKind + " " + name);
        if (type.isSampler() && variableKind != VariableKind.UNIFORM)
            throw new IllegalArgumentException("Sampler " + name + " must be a uniform");
        if (variableKind != VariableKind.UNIFORM && type.componentType() != ShaderType.FLOAT)
            throw new IllegalArgumentException(
                    variableKind.qualifier() + " " + name + " must be float-based, got " + type);
    }

    public VariableNode(VariableKind variableKind, String name, ShaderType type) {
        this(variableKind, name, type, null);
    }

    /**
     * Validates a GLSL identifier: not reserved, not in the {@code gl_}
     * namespace and without a double underscore.
     */
    public static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches())
            throw new IllegalArgumentException("Not a valid identifier: " + name);
        if (name.startsWith("gl_"))
            throw new IllegalArgumentException("Identifier uses reserved prefix gl_: " + name);
        if (GlslReservedWords.isReserved(name))
            throw new IllegalArgumentException("Identifier is reserved in GLSL: " + name);
        return name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public List<Node> operands() {
        return List.of();
    }

    public VariableKind variableKind() {
        return variableKind;
    }

    public String name() {
        return name;
    }

    /** The precision qualifier, or null. */
    public Precision precision() {
        return precision;
    }

    /**
     * Returns true if both variables denote the same external binding: same name,
     * kind, type and precision.
     */
    public boolean sameBinding(VariableNode other) {
        return name.equals(other.name) && variableKind == other.variableKind
                && type() == other.type() && precision == other.precision;
    }

    /** Human-readable declaration, used in diagnostics. */
    public String describe() {
        return variableKind.qualifier() + (precision != null ? " " + precision.keyword() : "")
                + " " + type().glslName() + " " + name + " (#" + id() + ")";
    }

    @Override
    public String toString() {
        return super.toString() + "[" + variableKind.qualifier() + " " + name + "]";
    }
}
