package com.shading.sgc.engine;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.ShaderType;

import java.util.Map;

/**
 * A named program output and the root expression assigned to it.
 *
 * @param name    Output identifier.
 * @param type    Declared type of the output.
 * @param builtin True for the predefined {@code gl_} outputs, which are not
 *                declared.
 * @param value   Root node whose value is assigned.
 */
public record OutputTarget(String name, ShaderType type, boolean builtin, Node value) {

    /** Predefined outputs of GLSL ES 1.00 with their types. */
    public static final Map<String, ShaderType> BUILTINS = Map.of(
            "gl_Position", ShaderType.VEC4,
            "gl_PointSize", ShaderType.FLOAT,
            "gl_FragColor", ShaderType.VEC4);

    public static boolean isBuiltinName(String name) {
        return name.startsWith("gl_");
    }
}
