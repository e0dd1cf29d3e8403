package com.shading.sgc;

import com.shading.sgc.config.CompileOptions;
import com.shading.sgc.dsl.ShaderBuilder;
import com.shading.sgc.engine.ProgramCompiler;
import com.shading.sgc.io.JsonShaderGraphLoader;
import com.shading.sgc.types.GlslSignatureTable;

/**
 * Shader Graph -- compiles expression graphs into GLSL ES shader source.
 *
 * <h2>Model</h2>
 * <p>
 * A shader is written as a directed acyclic graph of typed expression nodes:
 * <ul>
 * <li><b>Variables</b> are the attributes, uniforms and varyings the shader
 * reads.</li>
 * <li><b>Operators</b> apply arithmetic, built-in functions, constructors and
 * swizzles; they are type-checked when created.</li>
 * <li><b>Conditionals</b> select between two values.</li>
 * </ul>
 * Nodes referenced from several places are computed once into a temporary;
 * everything else is inlined. The same graph always compiles to the same
 * text.
 *
 * <h3>Entry points</h3>
 * <ul>
 * <li>{@link #builder()} for writing graphs in Java.</li>
 * <li>{@link #loader()} for graphs defined in JSON.</li>
 * <li>{@link #compiler()} for compiling nodes built elsewhere.</li>
 * </ul>
 */
public final class ShaderGraph {

    private ShaderGraph() {
        // Prevent instantiation of utility class
    }

    /** A new builder over GLSL ES 1.00 with default options. */
    public static ShaderBuilder builder() {
        return ShaderBuilder.create();
    }

    public static ShaderBuilder builder(CompileOptions options) {
        return ShaderBuilder.create(options);
    }

    public static ProgramCompiler compiler() {
        return compiler(CompileOptions.defaults());
    }

    public static ProgramCompiler compiler(CompileOptions options) {
        return new ProgramCompiler(GlslSignatureTable.glslEs100(), options);
    }

    public static JsonShaderGraphLoader loader() {
        return new JsonShaderGraphLoader(GlslSignatureTable.glslEs100());
    }
}
