package com.shading.sgc.config;

import com.shading.sgc.api.Precision;
import com.shading.sgc.node.VariableNode;

import java.util.Objects;

import lombok.With;

/**
 * Settings that shape the emitted program text.
 *
 * @param versionDirective Value of the {@code #version} line, or null to omit
 *                         it.
 * @param floatPrecision   Default float precision statement, or null to omit
 *                         it.
 * @param temporaryPrefix  Prefix of generated temporaries ({@code t0, t1, ...}).
 * @param defaultOutput    Output a single-root compilation assigns to.
 * @param indent           Indentation unit of the {@code main} body.
 */
@With
public record CompileOptions(String versionDirective, Precision floatPrecision, String temporaryPrefix,
        String defaultOutput, String indent) {

    public static final String DEFAULT_TEMPORARY_PREFIX = "t";
    public static final String DEFAULT_OUTPUT = "gl_FragColor";

    public CompileOptions {
        VariableNode.requireIdentifier(temporaryPrefix);
        Objects.requireNonNull(defaultOutput, "defaultOutput");
        Objects.requireNonNull(indent, "indent");
        if (versionDirective != null && !versionDirective.matches("[0-9]+( [a-z]+)?"))
            throw new IllegalArgumentException("Bad version directive: " + versionDirective);
    }

    /** No version line, no precision statement, {@code t} temporaries, gl_FragColor output. */
    public static CompileOptions defaults() {
        return new CompileOptions(null, null, DEFAULT_TEMPORARY_PREFIX, DEFAULT_OUTPUT, "    ");
    }

    /** Defaults plus the header a GLSL ES 1.00 fragment shader needs. */
    public static CompileOptions fragmentShader() {
        return defaults().withVersionDirective("100").withFloatPrecision(Precision.MEDIUMP);
    }
}
