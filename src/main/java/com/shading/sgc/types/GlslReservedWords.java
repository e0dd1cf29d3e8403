package com.shading.sgc.types;

import java.util.Set;

/**
 * Identifiers a GLSL ES 1.00 program may not declare: keywords, words reserved
 * for future use, built-in type and function names, and {@code main}, which
 * every emitted program defines.
 */
public final class GlslReservedWords {
    private GlslReservedWords() {
        // Utility class
    }

    private static final Set<String> KEYWORDS = Set.of(
            "attribute", "const", "uniform", "varying", "break", "continue", "do", "for", "while",
            "if", "else", "in", "out", "inout", "float", "int", "void", "bool", "true", "false",
            "lowp", "mediump", "highp", "precision", "invariant", "discard", "return",
            "mat2", "mat3", "mat4", "vec2", "vec3", "vec4", "ivec2", "ivec3", "ivec4",
            "bvec2", "bvec3", "bvec4", "sampler2D", "samplerCube", "struct");

    private static final Set<String> FUTURE = Set.of(
            "asm", "class", "union", "enum", "typedef", "template", "this", "packed", "goto", "switch",
            "default", "inline", "noinline", "volatile", "public", "static", "extern", "external",
            "interface", "flat", "long", "short", "double", "half", "fixed", "unsigned", "superp",
            "input", "output", "hvec2", "hvec3", "hvec4", "dvec2", "dvec3", "dvec4",
            "fvec2", "fvec3", "fvec4", "sampler1D", "sampler3D", "sampler1DShadow", "sampler2DShadow",
            "sampler2DRect", "sampler3DRect", "sampler2DRectShadow", "sizeof", "cast", "namespace", "using");

    private static final Set<String> BUILTIN_FUNCTIONS = Set.of(
            "main", "radians", "degrees", "sin", "cos", "tan", "asin", "acos", "atan", "pow", "exp", "log",
            "exp2", "log2", "sqrt", "inversesqrt", "abs", "sign", "floor", "ceil", "fract", "mod", "min",
            "max", "clamp", "mix", "step", "smoothstep", "length", "distance", "dot", "cross", "normalize",
            "faceforward", "reflect", "refract", "matrixCompMult", "lessThan", "lessThanEqual",
            "greaterThan", "greaterThanEqual", "equal", "notEqual", "any", "all", "not",
            "texture2D", "texture2DProj", "texture2DLod", "texture2DProjLod", "textureCube", "textureCubeLod");

    /**
     * Returns true if the name cannot be declared: it is reserved, or it
     * contains a double underscore.
     */
    public static boolean isReserved(String name) {
        return name.contains("__") || KEYWORDS.contains(name) || FUTURE.contains(name)
                || BUILTIN_FUNCTIONS.contains(name);
    }
}
