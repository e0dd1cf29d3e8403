package com.shading.sgc.types;

import com.shading.sgc.api.OperatorSyntax;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.Signature;
import com.shading.sgc.api.SignatureTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.shading.sgc.api.ShaderType.*;

/**
 * Operator vocabulary of GLSL ES 1.00 (the WebGL 1 shading language).
 *
 * The table is built once and never modified. Overloads that are uniform over
 * vector width (genType) are expanded here into one concrete overload per
 * width, so lookup is a plain list scan. Swizzles are derived from the
 * operator symbol on demand.
 */
public final class GlslSignatureTable implements SignatureTable {
    // Infix precedence levels, higher binds tighter.
    public static final int MULTIPLICATIVE = 14;
    public static final int ADDITIVE = 13;
    public static final int RELATIONAL = 11;
    public static final int EQUALITY = 10;
    public static final int LOGICAL_AND = 6;
    public static final int LOGICAL_XOR = 5;
    public static final int LOGICAL_OR = 4;

    private static final List<ShaderType> GEN_FLOAT = List.of(FLOAT, VEC2, VEC3, VEC4);
    private static final List<ShaderType> GEN_INT = List.of(INT, IVEC2, IVEC3, IVEC4);
    private static final List<ShaderType> FLOAT_VECTORS = List.of(VEC2, VEC3, VEC4);
    private static final List<ShaderType> INT_VECTORS = List.of(IVEC2, IVEC3, IVEC4);
    private static final List<ShaderType> BOOL_VECTORS = List.of(BVEC2, BVEC3, BVEC4);
    private static final List<ShaderType> MATRICES = List.of(MAT2, MAT3, MAT4);

    private static final Pattern SWIZZLE = Pattern.compile("\\.([xyzw]{1,4}|[rgba]{1,4}|[stpq]{1,4})");
    private static final String[] SWIZZLE_SETS = { "xyzw", "rgba", "stpq" };

    private static final GlslSignatureTable INSTANCE = new GlslSignatureTable();

    private final Map<String, List<Signature>> byOperator;

    private GlslSignatureTable() {
        Map<String, List<Signature>> m = new LinkedHashMap<>();
        registerArithmetic(m);
        registerComparisons(m);
        registerBuiltinFunctions(m);
        registerTextureLookups(m);
        registerConstructors(m);

        Map<String, List<Signature>> frozen = new LinkedHashMap<>(m.size() * 2);
        m.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.byOperator = Collections.unmodifiableMap(frozen);
    }

    /** The shared, immutable GLSL ES 1.00 table. */
    public static GlslSignatureTable glslEs100() {
        return INSTANCE;
    }

    @Override
    public String dialect() {
        return "glsl-es-100";
    }

    @Override
    public List<Signature> signatures(String operator) {
        List<Signature> found = byOperator.get(operator);
        if (found != null)
            return found;
        if (operator != null && SWIZZLE.matcher(operator).matches())
            return swizzles(operator);
        return List.of();
    }

    /** Names of all non-swizzle operators, in registration order. */
    public List<String> operators() {
        return List.copyOf(byOperator.keySet());
    }

    // ── Operators ────────────────────────────────────────────────

    private static void registerArithmetic(Map<String, List<Signature>> m) {
        for (String op : List.of("+", "-", "*", "/")) {
            int prec = op.equals("+") || op.equals("-") ? ADDITIVE : MULTIPLICATIVE;
            for (ShaderType t : GEN_FLOAT)
                add(m, Signature.infix(op, prec, t, t, t));
            for (ShaderType t : GEN_INT)
                add(m, Signature.infix(op, prec, t, t, t));
            for (ShaderType v : FLOAT_VECTORS) {
                add(m, Signature.infix(op, prec, v, v, FLOAT));
                add(m, Signature.infix(op, prec, v, FLOAT, v));
            }
            for (ShaderType v : INT_VECTORS) {
                add(m, Signature.infix(op, prec, v, v, INT));
                add(m, Signature.infix(op, prec, v, INT, v));
            }
            for (ShaderType mat : MATRICES) {
                add(m, Signature.infix(op, prec, mat, mat, mat));
                add(m, Signature.infix(op, prec, mat, mat, FLOAT));
                add(m, Signature.infix(op, prec, mat, FLOAT, mat));
            }
        }
        for (ShaderType mat : MATRICES) {
            ShaderType col = ShaderType.vector(FLOAT, mat.width());
            add(m, Signature.infix("*", MULTIPLICATIVE, col, mat, col));
            add(m, Signature.infix("*", MULTIPLICATIVE, col, col, mat));
        }

        for (ShaderType t : GEN_FLOAT)
            add(m, Signature.prefix("-", t, t));
        for (ShaderType t : GEN_INT)
            add(m, Signature.prefix("-", t, t));
        for (ShaderType mat : MATRICES)
            add(m, Signature.prefix("-", mat, mat));
        add(m, Signature.prefix("!", BOOL, BOOL));
    }

    private static void registerComparisons(Map<String, List<Signature>> m) {
        for (String op : List.of("<", ">", "<=", ">=")) {
            add(m, Signature.infix(op, RELATIONAL, BOOL, FLOAT, FLOAT));
            add(m, Signature.infix(op, RELATIONAL, BOOL, INT, INT));
        }
        for (String op : List.of("==", "!=")) {
            for (ShaderType t : ShaderType.values()) {
                if (!t.isSampler())
                    add(m, Signature.infix(op, EQUALITY, BOOL, t, t));
            }
        }
        add(m, Signature.infix("&&", LOGICAL_AND, BOOL, BOOL, BOOL));
        add(m, Signature.infix("^^", LOGICAL_XOR, BOOL, BOOL, BOOL));
        add(m, Signature.infix("||", LOGICAL_OR, BOOL, BOOL, BOOL));
    }

    private static void registerBuiltinFunctions(Map<String, List<Signature>> m) {
        for (String fn : List.of("radians", "degrees", "sin", "cos", "tan", "asin", "acos", "atan",
                "exp", "log", "exp2", "log2", "sqrt", "inversesqrt",
                "abs", "sign", "floor", "ceil", "fract", "normalize")) {
            for (ShaderType t : GEN_FLOAT)
                add(m, Signature.call(fn, t, t));
        }
        for (String fn : List.of("atan", "pow", "mod", "min", "max", "step", "reflect")) {
            for (ShaderType t : GEN_FLOAT)
                add(m, Signature.call(fn, t, t, t));
        }
        for (ShaderType v : FLOAT_VECTORS) {
            add(m, Signature.call("mod", v, v, FLOAT));
            add(m, Signature.call("min", v, v, FLOAT));
            add(m, Signature.call("max", v, v, FLOAT));
            add(m, Signature.call("step", v, FLOAT, v));
        }
        for (ShaderType t : GEN_FLOAT) {
            add(m, Signature.call("length", FLOAT, t));
            add(m, Signature.call("distance", FLOAT, t, t));
            add(m, Signature.call("dot", FLOAT, t, t));
            add(m, Signature.call("clamp", t, t, t, t));
            add(m, Signature.call("mix", t, t, t, t));
            add(m, Signature.call("smoothstep", t, t, t, t));
            add(m, Signature.call("faceforward", t, t, t, t));
            add(m, Signature.call("refract", t, t, t, FLOAT));
        }
        for (ShaderType v : FLOAT_VECTORS) {
            add(m, Signature.call("clamp", v, v, FLOAT, FLOAT));
            add(m, Signature.call("mix", v, v, v, FLOAT));
            add(m, Signature.call("smoothstep", v, FLOAT, FLOAT, v));
        }
        add(m, Signature.call("cross", VEC3, VEC3, VEC3));
        for (ShaderType mat : MATRICES)
            add(m, Signature.call("matrixCompMult", mat, mat, mat));

        for (int w = 2; w <= 4; w++) {
            ShaderType bv = ShaderType.vector(BOOL, w);
            for (ShaderType v : List.of(ShaderType.vector(FLOAT, w), ShaderType.vector(INT, w))) {
                for (String fn : List.of("lessThan", "lessThanEqual", "greaterThan", "greaterThanEqual",
                        "equal", "notEqual"))
                    add(m, Signature.call(fn, bv, v, v));
            }
            add(m, Signature.call("equal", bv, bv, bv));
            add(m, Signature.call("notEqual", bv, bv, bv));
            add(m, Signature.call("any", BOOL, bv));
            add(m, Signature.call("all", BOOL, bv));
            add(m, Signature.call("not", bv, bv));
        }
    }

    private static void registerTextureLookups(Map<String, List<Signature>> m) {
        add(m, Signature.call("texture2D", VEC4, SAMPLER_2D, VEC2));
        add(m, Signature.call("texture2D", VEC4, SAMPLER_2D, VEC2, FLOAT));
        add(m, Signature.call("texture2DProj", VEC4, SAMPLER_2D, VEC3));
        add(m, Signature.call("texture2DProj", VEC4, SAMPLER_2D, VEC4));
        add(m, Signature.call("textureCube", VEC4, SAMPLER_CUBE, VEC3));
        add(m, Signature.call("textureCube", VEC4, SAMPLER_CUBE, VEC3, FLOAT));
    }

    // ── Constructors ─────────────────────────────────────────────

    private static void registerConstructors(Map<String, List<Signature>> m) {
        List<ShaderType> scalars = List.of(FLOAT, INT, BOOL);
        for (ShaderType target : scalars) {
            for (ShaderType from : scalars)
                add(m, Signature.call(target.glslName(), target, from));
        }

        List<ShaderType> vectors = new ArrayList<>(FLOAT_VECTORS);
        vectors.addAll(INT_VECTORS);
        vectors.addAll(BOOL_VECTORS);
        for (ShaderType v : vectors) {
            String name = v.glslName();
            ShaderType component = v.componentType();
            // splat
            add(m, Signature.call(name, v, component));
            for (ShaderType s : scalars) {
                if (s != component)
                    add(m, Signature.call(name, v, s));
            }
            // component-wise assembly
            for (List<ShaderType> parts : compositions(component, v.width()))
                add(m, Signature.call(name, v, parts.toArray(new ShaderType[0])));
            // truncation of a wider vector
            for (int w = v.width() + 1; w <= 4; w++)
                add(m, Signature.call(name, v, ShaderType.vector(component, w)));
            // conversion from a vector of another component type, same width or wider
            for (ShaderType s : scalars) {
                if (s == component)
                    continue;
                for (int w = v.width(); w <= 4; w++)
                    add(m, Signature.call(name, v, ShaderType.vector(s, w)));
            }
        }

        // scalar from the first component of a vector
        for (ShaderType target : scalars) {
            for (ShaderType v : vectors)
                add(m, Signature.call(target.glslName(), target, v));
        }

        for (ShaderType mat : MATRICES) {
            String name = mat.glslName();
            int n = mat.width();
            add(m, Signature.call(name, mat, FLOAT));

            ShaderType[] columns = new ShaderType[n];
            Arrays.fill(columns, ShaderType.vector(FLOAT, n));
            add(m, Signature.call(name, mat, columns));

            ShaderType[] scalarsIn = new ShaderType[n * n];
            Arrays.fill(scalarsIn, FLOAT);
            add(m, Signature.call(name, mat, scalarsIn));
        }
    }

    /**
     * All ordered ways of covering {@code width} components with scalars and
     * vectors of the given component type.
     */
    static List<List<ShaderType>> compositions(ShaderType component, int width) {
        List<List<ShaderType>> out = new ArrayList<>();
        compose(component, width, new ArrayList<>(), out);
        return out;
    }

    private static void compose(ShaderType component, int remaining, List<ShaderType> prefix,
            List<List<ShaderType>> out) {
        if (remaining == 0) {
            out.add(List.copyOf(prefix));
            return;
        }
        for (int w = 1; w <= remaining; w++) {
            prefix.add(ShaderType.vector(component, w));
            compose(component, remaining - w, prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }

    // ── Swizzles ─────────────────────────────────────────────────

    private static List<Signature> swizzles(String operator) {
        String components = operator.substring(1);
        String set = null;
        for (String s : SWIZZLE_SETS) {
            if (s.indexOf(components.charAt(0)) >= 0)
                set = s;
        }
        int highest = 0;
        for (char c : components.toCharArray())
            highest = Math.max(highest, set.indexOf(c));

        List<Signature> out = new ArrayList<>();
        List<ShaderType> sources = new ArrayList<>(FLOAT_VECTORS);
        sources.addAll(INT_VECTORS);
        sources.addAll(BOOL_VECTORS);
        for (ShaderType v : sources) {
            if (highest < v.width())
                out.add(new Signature(operator, OperatorSyntax.FIELD, Signature.POSTFIX, List.of(v),
                        ShaderType.vector(v.componentType(), components.length())));
        }
        return List.copyOf(out);
    }

    private static void add(Map<String, List<Signature>> m, Signature s) {
        m.computeIfAbsent(s.operator(), k -> new ArrayList<>()).add(s);
    }
}
