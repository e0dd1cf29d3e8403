package com.shading.sgc.api;

/**
 * The closed set of value types a shader expression can have.
 *
 * Every type knows its GLSL keyword, the scalar type of its components and how
 * many components it has. Matrices report their column count as width and
 * {@link #FLOAT} as component type; samplers are opaque and have width 0.
 *
 * Type equality is enum identity.
 */
public enum ShaderType {
    BOOL("bool", Category.SCALAR, 1),
    INT("int", Category.SCALAR, 1),
    FLOAT("float", Category.SCALAR, 1),

    VEC2("vec2", Category.VECTOR, 2),
    VEC3("vec3", Category.VECTOR, 3),
    VEC4("vec4", Category.VECTOR, 4),
    BVEC2("bvec2", Category.VECTOR, 2),
    BVEC3("bvec3", Category.VECTOR, 3),
    BVEC4("bvec4", Category.VECTOR, 4),
    IVEC2("ivec2", Category.VECTOR, 2),
    IVEC3("ivec3", Category.VECTOR, 3),
    IVEC4("ivec4", Category.VECTOR, 4),

    MAT2("mat2", Category.MATRIX, 2),
    MAT3("mat3", Category.MATRIX, 3),
    MAT4("mat4", Category.MATRIX, 4),

    SAMPLER_2D("sampler2D", Category.SAMPLER, 0),
    SAMPLER_CUBE("samplerCube", Category.SAMPLER, 0);

    /** Coarse shape of a type. */
    public enum Category {
        SCALAR, VECTOR, MATRIX, SAMPLER
    }

    private final String glslName;
    private final Category category;
    private final int width;

    ShaderType(String glslName, Category category, int width) {
        this.glslName = glslName;
        this.category = category;
        this.width = width;
    }

    public String glslName() {
        return glslName;
    }

    public Category category() {
        return category;
    }

    /** Number of components (vectors), columns (matrices), 1 for scalars, 0 for samplers. */
    public int width() {
        return width;
    }

    public boolean isScalar() {
        return category == Category.SCALAR;
    }

    public boolean isVector() {
        return category == Category.VECTOR;
    }

    public boolean isMatrix() {
        return category == Category.MATRIX;
    }

    public boolean isSampler() {
        return category == Category.SAMPLER;
    }

    /**
     * Scalar type of each component: the type itself for scalars, FLOAT for
     * float vectors and matrices, BOOL/INT for boolean and integer vectors.
     * Samplers have no component type and return null.
     */
    public ShaderType componentType() {
        return switch (this) {
            case BOOL, BVEC2, BVEC3, BVEC4 -> BOOL;
            case INT, IVEC2, IVEC3, IVEC4 -> INT;
            case FLOAT, VEC2, VEC3, VEC4, MAT2, MAT3, MAT4 -> FLOAT;
            case SAMPLER_2D, SAMPLER_CUBE -> null;
        };
    }

    /** Total scalar count; a matN has N*N components. */
    public int componentCount() {
        return isMatrix() ? width * width : width;
    }

    /**
     * Returns the scalar (width 1) or vector type with the given component type
     * and width.
     *
     * @throws IllegalArgumentException if no such type exists.
     */
    public static ShaderType vector(ShaderType componentType, int width) {
        if (width == 1 && componentType.isScalar())
            return componentType;
        for (ShaderType t : values()) {
            if (t.isVector() && t.width == width && t.componentType() == componentType)
                return t;
        }
        throw new IllegalArgumentException("No vector of " + componentType + " with width " + width);
    }

    /** Returns the square matrix type with the given column count. */
    public static ShaderType matrix(int columns) {
        return switch (columns) {
            case 2 -> MAT2;
            case 3 -> MAT3;
            case 4 -> MAT4;
            default -> throw new IllegalArgumentException("No matrix with " + columns + " columns");
        };
    }

    /** Resolves a GLSL keyword (e.g. "vec3") or enum name (e.g. "SAMPLER_2D"). */
    public static ShaderType fromString(String text) {
        for (ShaderType t : values()) {
            if (t.glslName.equals(text) || t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new IllegalArgumentException("Unknown ShaderType: " + text);
    }

    @Override
    public String toString() {
        return glslName;
    }
}
