package com.shading.sgc.error;

/**
 * A node variant or operator outside the supported set reached the compiler,
 * typically because the graph was built against a different signature table.
 */
public class UnsupportedConstructException extends ShaderCompileException {
    public UnsupportedConstructException(String message, long nodeId) {
        super(message, nodeId);
    }
}
