package com.shading.sgc.dsl;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.Precision;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.SignatureTable;
import com.shading.sgc.api.VariableKind;
import com.shading.sgc.config.CompileOptions;
import com.shading.sgc.engine.CompiledProgram;
import com.shading.sgc.engine.ProgramCompiler;
import com.shading.sgc.error.NameCollisionException;
import com.shading.sgc.node.ConditionalNode;
import com.shading.sgc.node.LiteralNode;
import com.shading.sgc.node.OperatorNode;
import com.shading.sgc.node.VariableNode;
import com.shading.sgc.types.GlslSignatureTable;
import com.shading.sgc.types.TypeChecker;

import java.util.*;

/**
 * Shader Builder -- the fluent API for writing expression graphs.
 *
 * Every method returns a checked, immutable {@link Node}; a call whose operands
 * do not type-check throws at once and no node is created. Reusing a returned
 * node in several places shares it: the compiler evaluates it once.
 *
 * Usage Pattern:
 * 1. Create a builder: ShaderBuilder s = ShaderBuilder.create();
 * 2. Declare inputs: var uv = s.varying("v_Uv", ShaderType.VEC2);
 * 3. Combine: var c = s.texture2D(s.uniform("u_Tex", ShaderType.SAMPLER_2D), uv);
 * 4. Assign outputs: s.output("gl_FragColor", c);
 * 5. Build: String source = s.buildSource();
 */
public final class ShaderBuilder {
    private final SignatureTable table;
    private final TypeChecker checker;
    private final CompileOptions options;

    private final Map<String, VariableNode> variablesByName = new HashMap<>();
    private final Map<String, Node> outputs = new LinkedHashMap<>();

    // Flag to prevent modification after building
    private boolean built;

    private ShaderBuilder(SignatureTable table, CompileOptions options) {
        this.table = Objects.requireNonNull(table, "table");
        this.checker = new TypeChecker(table);
        this.options = Objects.requireNonNull(options, "options");
    }

    /** Builder over the GLSL ES 1.00 table with default options. */
    public static ShaderBuilder create() {
        return new ShaderBuilder(GlslSignatureTable.glslEs100(), CompileOptions.defaults());
    }

    public static ShaderBuilder create(CompileOptions options) {
        return new ShaderBuilder(GlslSignatureTable.glslEs100(), options);
    }

    public static ShaderBuilder create(SignatureTable table, CompileOptions options) {
        return new ShaderBuilder(table, options);
    }

    public TypeChecker checker() {
        return checker;
    }

    // ── Inputs ───────────────────────────────────────────────────

    public VariableNode attribute(String name, ShaderType type) {
        return variable(new VariableNode(VariableKind.ATTRIBUTE, name, type));
    }

    public VariableNode uniform(String name, ShaderType type) {
        return variable(new VariableNode(VariableKind.UNIFORM, name, type));
    }

    public VariableNode varying(String name, ShaderType type) {
        return variable(new VariableNode(VariableKind.VARYING, name, type));
    }

    public VariableNode varying(String name, ShaderType type, Precision precision) {
        return variable(new VariableNode(VariableKind.VARYING, name, type, precision));
    }

    /**
     * Declaring the same binding twice returns the first node; redeclaring a
     * name with a different kind, type or precision is a collision.
     */
    private VariableNode variable(VariableNode candidate) {
        checkNotBuilt();
        VariableNode existing = variablesByName.putIfAbsent(candidate.name(), candidate);
        if (existing == null)
            return candidate;
        if (!existing.sameBinding(candidate))
            throw new NameCollisionException(candidate.name(), existing.describe(), candidate.describe(),
                    candidate.id());
        return existing;
    }

    // ── Literals ─────────────────────────────────────────────────

    public LiteralNode literal(double value) {
        return LiteralNode.ofFloat(value);
    }

    public LiteralNode literal(int value) {
        return LiteralNode.ofInt(value);
    }

    public LiteralNode literal(boolean value) {
        return LiteralNode.ofBool(value);
    }

    // ── Operators ────────────────────────────────────────────────

    /**
     * Applies any operator of the table: an infix symbol, a built-in function,
     * a constructor keyword or a swizzle such as {@code ".xy"}.
     */
    public OperatorNode op(String operator, Node... operands) {
        checkNotBuilt();
        return OperatorNode.create(checker, operator, Arrays.asList(operands));
    }

    public OperatorNode add(Node a, Node b) {
        return op("+", a, b);
    }

    public OperatorNode sub(Node a, Node b) {
        return op("-", a, b);
    }

    public OperatorNode mul(Node a, Node b) {
        return op("*", a, b);
    }

    public OperatorNode div(Node a, Node b) {
        return op("/", a, b);
    }

    public OperatorNode neg(Node a) {
        return op("-", a);
    }

    public OperatorNode not(Node a) {
        return op("!", a);
    }

    public OperatorNode lt(Node a, Node b) {
        return op("<", a, b);
    }

    public OperatorNode gt(Node a, Node b) {
        return op(">", a, b);
    }

    public OperatorNode le(Node a, Node b) {
        return op("<=", a, b);
    }

    public OperatorNode ge(Node a, Node b) {
        return op(">=", a, b);
    }

    public OperatorNode eq(Node a, Node b) {
        return op("==", a, b);
    }

    public OperatorNode ne(Node a, Node b) {
        return op("!=", a, b);
    }

    public OperatorNode and(Node a, Node b) {
        return op("&&", a, b);
    }

    public OperatorNode or(Node a, Node b) {
        return op("||", a, b);
    }

    public OperatorNode xor(Node a, Node b) {
        return op("^^", a, b);
    }

    // ── Built-in functions ───────────────────────────────────────

    public OperatorNode sin(Node a) {
        return op("sin", a);
    }

    public OperatorNode cos(Node a) {
        return op("cos", a);
    }

    public OperatorNode abs(Node a) {
        return op("abs", a);
    }

    public OperatorNode sqrt(Node a) {
        return op("sqrt", a);
    }

    public OperatorNode fract(Node a) {
        return op("fract", a);
    }

    public OperatorNode floor(Node a) {
        return op("floor", a);
    }

    public OperatorNode normalize(Node a) {
        return op("normalize", a);
    }

    public OperatorNode length(Node a) {
        return op("length", a);
    }

    public OperatorNode pow(Node a, Node b) {
        return op("pow", a, b);
    }

    public OperatorNode min(Node a, Node b) {
        return op("min", a, b);
    }

    public OperatorNode max(Node a, Node b) {
        return op("max", a, b);
    }

    public OperatorNode step(Node edge, Node x) {
        return op("step", edge, x);
    }

    public OperatorNode dot(Node a, Node b) {
        return op("dot", a, b);
    }

    public OperatorNode cross(Node a, Node b) {
        return op("cross", a, b);
    }

    public OperatorNode clamp(Node x, Node lo, Node hi) {
        return op("clamp", x, lo, hi);
    }

    public OperatorNode mix(Node a, Node b, Node t) {
        return op("mix", a, b, t);
    }

    public OperatorNode smoothstep(Node lo, Node hi, Node x) {
        return op("smoothstep", lo, hi, x);
    }

    public OperatorNode texture2D(Node sampler, Node coord) {
        return op("texture2D", sampler, coord);
    }

    public OperatorNode textureCube(Node sampler, Node direction) {
        return op("textureCube", sampler, direction);
    }

    // ── Constructors and swizzles ────────────────────────────────

    public OperatorNode construct(ShaderType type, Node... parts) {
        return op(type.glslName(), parts);
    }

    public OperatorNode vec2(Node... parts) {
        return construct(ShaderType.VEC2, parts);
    }

    public OperatorNode vec3(Node... parts) {
        return construct(ShaderType.VEC3, parts);
    }

    public OperatorNode vec4(Node... parts) {
        return construct(ShaderType.VEC4, parts);
    }

    /** {@code swizzle(v, "xy")} is {@code v.xy}. */
    public OperatorNode swizzle(Node vector, String components) {
        return op("." + components, vector);
    }

    // ── Conditionals ─────────────────────────────────────────────

    /** {@code cond ? whenTrue : whenFalse}, always evaluated into a temporary. */
    public ConditionalNode ifThenElse(Node cond, Node whenTrue, Node whenFalse) {
        checkNotBuilt();
        return ConditionalNode.create(cond, whenTrue, whenFalse);
    }

    // ── Outputs and build ────────────────────────────────────────

    /**
     * Assigns a root to an output. Outputs are emitted in the order they are
     * first assigned.
     */
    public ShaderBuilder output(String name, Node value) {
        checkNotBuilt();
        Objects.requireNonNull(value, "value");
        if (outputs.putIfAbsent(name, value) != null)
            throw new IllegalArgumentException("Duplicate output: " + name);
        return this;
    }

    /**
     * Compiles the assigned outputs.
     *
     * @throws IllegalStateException if no output was assigned or the builder
     *                               was already built.
     */
    public CompiledProgram build() {
        checkNotBuilt();
        if (outputs.isEmpty())
            throw new IllegalStateException("No outputs assigned");
        built = true;
        return compiler().compile(outputs);
    }

    /** Compiles the assigned outputs to program text. */
    public String buildSource() {
        return compiler().emit(build());
    }

    private ProgramCompiler compiler() {
        return new ProgramCompiler(table, options);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Shader already built");
    }
}
