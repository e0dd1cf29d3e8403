package com.shading.sgc.error;

/**
 * Two different bindings of one compiled program want the same identifier.
 */
public class NameCollisionException extends ShaderCompileException {
    private final String name;

    public NameCollisionException(String name, String first, String second, long nodeId) {
        super("Name collision on '" + name + "': " + first + " vs " + second, nodeId);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
