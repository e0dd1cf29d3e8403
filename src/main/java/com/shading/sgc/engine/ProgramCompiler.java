package com.shading.sgc.engine;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.SignatureTable;
import com.shading.sgc.config.CompileOptions;
import com.shading.sgc.emit.GlslEmitter;
import com.shading.sgc.error.NameCollisionException;
import com.shading.sgc.error.ShaderCompileException;
import com.shading.sgc.error.TypeCheckException;
import com.shading.sgc.error.UnsupportedConstructException;
import com.shading.sgc.node.OperatorNode;
import com.shading.sgc.node.VariableNode;
import com.shading.sgc.types.GlslReservedWords;
import com.shading.sgc.types.TypeChecker;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a set of named roots into a {@link CompiledProgram} and, through the
 * {@link GlslEmitter}, into program text.
 *
 * Pipeline:
 * 1. Validate outputs: names, built-in output types.
 * 2. Analyze all roots in one {@link GraphAnalyzer} pass.
 * 3. Check every operator against the signature table.
 * 4. Collect input declarations and reject name collisions.
 * 5. Allocate temporaries in evaluation order, skipping reserved words.
 * 6. Lower materialized nodes into statements ({@link ConditionalLowering}).
 *
 * Any failure is thrown before text is produced; there is no partial output.
 * Compilers hold no per-compilation state and may be shared between threads.
 */
public final class ProgramCompiler {
    private static final Logger log = LogManager.getLogger(ProgramCompiler.class);

    private final SignatureTable table;
    private final CompileOptions options;
    private final GraphAnalyzer analyzer = new GraphAnalyzer();
    private final ConditionalLowering lowering = new ConditionalLowering();
    private final GlslEmitter emitter;

    public ProgramCompiler(SignatureTable table, CompileOptions options) {
        this.table = Objects.requireNonNull(table, "table");
        this.options = Objects.requireNonNull(options, "options");
        this.emitter = new GlslEmitter(table, options);
    }

    public SignatureTable table() {
        return table;
    }

    public CompileOptions options() {
        return options;
    }

    /**
     * Compiles a single root assigned to the configured default output.
     */
    public CompiledProgram compile(Node root) {
        return compile(Map.of(options.defaultOutput(), root));
    }

    /**
     * Compiles named roots. The map's iteration order is the output order, so
     * pass a {@link LinkedHashMap} when compiling several roots.
     *
     * @throws TypeCheckException           if a root does not fit its built-in
     *                                      output.
     * @throws NameCollisionException        if two bindings share an identifier.
     * @throws UnsupportedConstructException if the graph contains nodes or
     *                                      operators outside this compiler's
     *                                      dialect.
     */
    public CompiledProgram compile(Map<String, ? extends Node> roots) {
        if (roots.isEmpty())
            throw new IllegalArgumentException("At least one output is required");

        // 1. Outputs
        List<OutputTarget> outputs = new ArrayList<>(roots.size());
        for (Map.Entry<String, ? extends Node> e : roots.entrySet())
            outputs.add(outputTarget(e.getKey(), Objects.requireNonNull(e.getValue(), e.getKey())));

        // 2. One analysis over every root
        Analysis analysis = analyzer.analyze(new ArrayList<>(roots.values()));

        // 3. Operators must belong to this dialect
        for (Node node : analysis.evaluationOrder()) {
            if (node instanceof OperatorNode op && !table.supports(op.signature()))
                throw new UnsupportedConstructException("Operator " + op.signature()
                        + " is not part of dialect " + table.dialect(), op.id());
        }

        // 4. Inputs and name collisions
        List<VariableNode> inputs = collectInputs(analysis);
        Set<String> reserved = new HashSet<>();
        for (VariableNode v : inputs) {
            if (!table.signatures(v.name()).isEmpty())
                throw new NameCollisionException(v.name(), v.describe(),
                        "operator " + v.name() + " of dialect " + table.dialect(), v.id());
            reserved.add(v.name());
        }
        for (OutputTarget out : outputs) {
            if (reserved.contains(out.name())) {
                VariableNode clash = inputs.stream().filter(v -> v.name().equals(out.name())).findFirst()
                        .orElseThrow();
                throw new NameCollisionException(out.name(), clash.describe(),
                        "output " + out.type().glslName() + " " + out.name(), out.value().id());
            }
            if (!out.builtin() && !table.signatures(out.name()).isEmpty())
                throw new NameCollisionException(out.name(), "output " + out.type().glslName() + " " + out.name(),
                        "operator " + out.name() + " of dialect " + table.dialect(), out.value().id());
            reserved.add(out.name());
        }

        // 5. Temporaries, numbered in evaluation order
        Map<Long, String> temporaries = new LinkedHashMap<>();
        int counter = 0;
        for (Node node : analysis.materializedInOrder()) {
            String name;
            do {
                name = options.temporaryPrefix() + counter++;
            } while (!isFreeTemporary(name, reserved));
            reserved.add(name);
            temporaries.put(node.id(), name);
        }

        // 6. Statements
        List<Statement> statements = lowering.lowerAll(analysis, temporaries);

        log.debug("Compiled {} outputs: {} inputs, {} statements", outputs.size(), inputs.size(),
                statements.size());
        return new CompiledProgram(inputs, outputs, statements, temporaries);
    }

    /** Compiles a single root to text. */
    public String compileToText(Node root) {
        return emitter.emit(compile(root));
    }

    /** Compiles named roots to text. */
    public String compileToText(Map<String, ? extends Node> roots) {
        return emitter.emit(compile(roots));
    }

    /** Renders an already compiled program. */
    public String emit(CompiledProgram program) {
        return emitter.emit(program);
    }

    /**
     * Like {@link #compileToText(Map)}, but reports compile errors as a value.
     */
    public CompileResult tryCompile(Map<String, ? extends Node> roots) {
        try {
            return CompileResult.success(compileToText(roots));
        } catch (ShaderCompileException e) {
            log.warn("Shader compilation failed: {}", e.getMessage());
            return CompileResult.failure(e);
        }
    }

    /** Not declared by the program, not a GLSL word and not an operator of the table. */
    private boolean isFreeTemporary(String name, Set<String> reserved) {
        return !reserved.contains(name) && !GlslReservedWords.isReserved(name)
                && table.signatures(name).isEmpty();
    }

    private OutputTarget outputTarget(String name, Node value) {
        if (OutputTarget.isBuiltinName(name)) {
            ShaderType expected = OutputTarget.BUILTINS.get(name);
            if (expected == null)
                throw new UnsupportedConstructException("Unknown built-in output " + name, value.id());
            if (!TypeChecker.assignable(value, expected))
                throw new TypeCheckException("Output " + name + " expects " + expected + ", got " + value.type()
                        + " from #" + value.id(), "=", List.of(expected, value.type()), value.id());
            return new OutputTarget(name, expected, true, value);
        }

        VariableNode.requireIdentifier(name);
        if (value.type().componentType() != ShaderType.FLOAT)
            throw new TypeCheckException("Output " + name + " must be float-based, got " + value.type()
                    + " from #" + value.id(), "=", List.of(value.type()), value.id());
        return new OutputTarget(name, value.type(), false, value);
    }

    /**
     * Distinct variables grouped by kind (attribute, uniform, varying), each
     * group in discovery order. Two variable nodes describing the same binding
     * are declared once; any other reuse of a name is a collision.
     */
    private static List<VariableNode> collectInputs(Analysis analysis) {
        Map<String, VariableNode> byName = new LinkedHashMap<>();
        for (Node node : analysis.discoveryOrder()) {
            if (!(node instanceof VariableNode v))
                continue;
            VariableNode existing = byName.putIfAbsent(v.name(), v);
            if (existing != null && !existing.sameBinding(v))
                throw new NameCollisionException(v.name(), existing.describe(), v.describe(), v.id());
        }
        List<VariableNode> inputs = new ArrayList<>(byName.values());
        inputs.sort(Comparator.comparing(VariableNode::variableKind)); // stable
        return inputs;
    }
}
