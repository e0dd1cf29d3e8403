package com.shading.sgc.engine;

import com.shading.sgc.error.ShaderCompileException;

/**
 * Outcome of a compilation for callers that prefer values to exceptions:
 * either the program text or the error that stopped compilation. There is no
 * partial result.
 */
public final class CompileResult {
    private final String source;
    private final ShaderCompileException error;

    private CompileResult(String source, ShaderCompileException error) {
        this.source = source;
        this.error = error;
    }

    public static CompileResult success(String source) {
        return new CompileResult(source, null);
    }

    public static CompileResult failure(ShaderCompileException error) {
        return new CompileResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String source() {
        if (source == null)
            throw new IllegalStateException("Compilation failed, no source: " + error.getMessage(), error);
        return source;
    }

    public ShaderCompileException error() {
        if (error == null)
            throw new IllegalStateException("Compilation succeeded, no error");
        return error;
    }
}
