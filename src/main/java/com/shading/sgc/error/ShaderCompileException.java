package com.shading.sgc.error;

/**
 * Base class of every error raised while building or compiling a shader graph.
 *
 * All failures are caller programming errors detected eagerly: nothing is
 * retried and no partial output is ever produced.
 */
public class ShaderCompileException extends RuntimeException {
    /** Node id used when an error is not tied to a single node. */
    public static final long NO_NODE = -1L;

    private final long nodeId;

    public ShaderCompileException(String message) {
        this(message, NO_NODE);
    }

    public ShaderCompileException(String message, long nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    /**
     * Returns the id of the offending node, or {@link #NO_NODE}.
     */
    public long nodeId() {
        return nodeId;
    }
}
