package com.shading.sgc.emit;

import com.shading.sgc.api.SignatureTable;
import com.shading.sgc.config.CompileOptions;
import com.shading.sgc.engine.CompiledProgram;
import com.shading.sgc.engine.OutputTarget;
import com.shading.sgc.engine.Statement;
import com.shading.sgc.node.VariableNode;

import java.util.Objects;

/**
 * Renders a {@link CompiledProgram} as GLSL ES source text.
 *
 * Layout:
 * <pre>
 * #version 100                  (optional)
 * precision mediump float;      (optional)
 *
 * attribute vec4 a_Position;    inputs: attributes, uniforms, varyings
 * varying vec2 v_Uv;            user outputs
 *
 * void main() {
 *     float t0 = length(a_Position);
 *     ...
 *     v_Uv = vec2(t0, t0);
 * }
 * </pre>
 *
 * Rendering is a pure function of the program and the options: the same
 * program always yields byte-identical text.
 */
public final class GlslEmitter {
    private final SignatureTable table;
    private final CompileOptions options;

    public GlslEmitter(SignatureTable table, CompileOptions options) {
        this.table = Objects.requireNonNull(table, "table");
        this.options = Objects.requireNonNull(options, "options");
    }

    public String emit(CompiledProgram program) {
        ExpressionRenderer renderer = new ExpressionRenderer(table, program.temporaries());
        StringBuilder sb = new StringBuilder(1024);

        // 1. Header
        boolean header = false;
        if (options.versionDirective() != null) {
            sb.append("#version ").append(options.versionDirective()).append('\n');
            header = true;
        }
        if (options.floatPrecision() != null) {
            sb.append("precision ").append(options.floatPrecision().keyword()).append(" float;\n");
            header = true;
        }
        if (header)
            sb.append('\n');

        // 2. Declarations
        boolean declared = false;
        for (VariableNode v : program.inputs()) {
            sb.append(v.variableKind().qualifier()).append(' ');
            if (v.precision() != null)
                sb.append(v.precision().keyword()).append(' ');
            sb.append(v.type().glslName()).append(' ').append(v.name()).append(";\n");
            declared = true;
        }
        for (OutputTarget out : program.outputs()) {
            if (out.builtin())
                continue;
            sb.append("varying ").append(out.type().glslName()).append(' ').append(out.name()).append(";\n");
            declared = true;
        }
        if (declared)
            sb.append('\n');

        // 3. Body
        String indent = options.indent();
        sb.append("void main() {\n");
        for (Statement st : program.statements()) {
            String type = st.type().glslName();
            if (st instanceof Statement.ConditionalBlock block) {
                sb.append(indent).append(type).append(' ').append(block.temporary()).append(";\n");
                sb.append(indent).append("if (")
                        .append(renderer.reference(block.condition(), block.condition().type()))
                        .append(") {\n");
                sb.append(indent).append(indent).append(block.temporary()).append(" = ")
                        .append(renderer.reference(block.whenTrue(), block.type())).append(";\n");
                sb.append(indent).append("} else {\n");
                sb.append(indent).append(indent).append(block.temporary()).append(" = ")
                        .append(renderer.reference(block.whenFalse(), block.type())).append(";\n");
                sb.append(indent).append("}\n");
            } else {
                sb.append(indent).append(type).append(' ').append(st.temporary()).append(" = ")
                        .append(renderer.definition(st.node())).append(";\n");
            }
        }

        // 4. Outputs
        for (OutputTarget out : program.outputs()) {
            sb.append(indent).append(out.name()).append(" = ")
                    .append(renderer.reference(out.value(), out.type())).append(";\n");
        }
        return sb.append("}\n").toString();
    }
}
