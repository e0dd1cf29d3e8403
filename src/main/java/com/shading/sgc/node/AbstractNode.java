package com.shading.sgc.node;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.ShaderType;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class holding the identity and type every node carries.
 *
 * Ids come from a single process-wide atomic counter, so graphs built
 * concurrently on different threads never share an id.
 */
public abstract class AbstractNode implements Node {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    private final ShaderType type;

    protected AbstractNode(ShaderType type) {
        this.id = NEXT_ID.getAndIncrement();
        this.type = type;
    }

    @Override
    public final long id() {
        return id;
    }

    @Override
    public final ShaderType type() {
        return type;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + id + ":" + type.glslName();
    }
}
